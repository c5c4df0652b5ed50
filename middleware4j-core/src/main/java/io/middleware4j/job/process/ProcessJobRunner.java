package io.middleware4j.job.process;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.middleware4j.errors.CallException;
import io.middleware4j.errors.ErrorCode;
import io.middleware4j.job.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parent side of PROCESS-mode execution: launches a child JVM running {@link ProcessWorkerMain} on the current
 * classpath and relays its protocol lines back to the job.
 *
 * <p>The calling thread blocks until the child exits. Interrupting it (abort of a job) destroys the child.
 */
public class ProcessJobRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessJobRunner.class);

    private final ObjectMapper mapper;

    public ProcessJobRunner(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public Object run(Job job, Class<? extends ProcessJobBody> bodyClass) throws Exception {
        Objects.requireNonNull(bodyClass, "bodyClass must not be null");

        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(ProcessWorkerMain.class.getName());
        command.add(bodyClass.getName());

        Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
        log.debug("process job started id={} pid={} body={}", job.id(), process.pid(), bodyClass.getName());

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                mapper.writeValue(stdin, job.arguments());
            }

            JsonNode outcome = null;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (!line.startsWith(ProcessWorkerMain.PROTOCOL_PREFIX)) {
                        passThrough(job, line);
                        continue;
                    }
                    JsonNode msg = mapper.readTree(line.substring(ProcessWorkerMain.PROTOCOL_PREFIX.length()));
                    String type = msg.path("type").asText();
                    if ("progress".equals(type)) {
                        job.setProgress(
                                msg.hasNonNull("percent") ? msg.get("percent").asDouble() : null,
                                msg.hasNonNull("description") ? msg.get("description").asText() : null,
                                msg.hasNonNull("extra") ? mapper.treeToValue(msg.get("extra"), Object.class) : null);
                    } else {
                        outcome = msg;
                    }
                }
            }

            int exit = process.waitFor();
            log.debug("process job exited id={} exitCode={}", job.id(), exit);

            if (outcome != null && "result".equals(outcome.path("type").asText()) && exit == 0) {
                JsonNode value = outcome.get("value");
                return value == null || value.isNull() ? null : mapper.treeToValue(value, Object.class);
            }
            if (outcome != null && "error".equals(outcome.path("type").asText())) {
                Map<String, Object> extra = new LinkedHashMap<>();
                extra.put("type", outcome.path("errorType").asText());
                String trace = outcome.path("exception").asText(null);
                if (trace != null) {
                    extra.put("exception", trace);
                }
                throw new CallException(outcome.path("error").asText(), ErrorCode.EFAULT, extra);
            }
            throw new CallException("Process job " + job.id() + " exited with status " + exit, ErrorCode.EFAULT);
        } finally {
            if (process.isAlive()) {
                log.debug("destroying process job id={} pid={}", job.id(), process.pid());
                process.destroyForcibly();
            }
        }
    }

    private void passThrough(Job job, String line) throws IOException {
        if (job.options().logs()) {
            OutputStream logs = job.logs();
            logs.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            logs.flush();
        } else {
            log.debug("process job output id={}: {}", job.id(), line);
        }
    }
}
