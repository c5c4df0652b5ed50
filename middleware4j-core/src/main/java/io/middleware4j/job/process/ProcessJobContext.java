package io.middleware4j.job.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Child-side handle to the parent job. Progress is reported as protocol lines on stdout; anything else the body
 * prints ends up in the job's log.
 */
public final class ProcessJobContext {

    private final ObjectMapper mapper;
    private final PrintStream out;

    ProcessJobContext(ObjectMapper mapper, PrintStream out) {
        this.mapper = mapper;
        this.out = out;
    }

    public void setProgress(double percent) {
        setProgress(percent, null, null);
    }

    public void setProgress(double percent, String description) {
        setProgress(percent, description, null);
    }

    public void setProgress(Double percent, String description, Object extra) {
        Map<String, Object> msg = new LinkedHashMap<>();
        msg.put("type", "progress");
        msg.put("percent", percent);
        msg.put("description", description);
        msg.put("extra", extra);
        emit(msg);
    }

    /**
     * Free-form log line.
     */
    public void log(String line) {
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }

    void emit(Map<String, Object> message) {
        String json;
        try {
            json = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize " + message.get("type") + " message", e);
        }
        synchronized (out) {
            out.println(ProcessWorkerMain.PROTOCOL_PREFIX + json);
            out.flush();
        }
    }
}
