package io.middleware4j.core;

public enum JobState {
    WAITING {
        @Override
        public boolean isFinished() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isFinished() {
            return false;
        }
    },
    SUCCESS {
        @Override
        public boolean isFinished() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isFinished() {
            return true;
        }
    },
    ABORTED {
        @Override
        public boolean isFinished() {
            return true;
        }
    };

    public abstract boolean isFinished();
}
