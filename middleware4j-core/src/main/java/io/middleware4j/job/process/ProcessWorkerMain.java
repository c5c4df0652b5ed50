package io.middleware4j.job.process;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.Constructor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the child JVM that runs one {@link ProcessJobBody}.
 *
 * <p>Reads the JSON argument list from stdin, runs the body and reports through marked stdout lines:
 * <pre>
 * @@middleware4j {"type":"progress","percent":..,"description":..,"extra":..}
 * @@middleware4j {"type":"result","value":..}
 * @@middleware4j {"type":"error","error":..,"errorType":..,"exception":..}
 * </pre>
 * Exit status is 0 on success and 1 on failure.
 */
public final class ProcessWorkerMain {

    public static final String PROTOCOL_PREFIX = "@@middleware4j ";

    private ProcessWorkerMain() {
    }

    public static void main(String[] argv) {
        ObjectMapper mapper = new ObjectMapper();
        PrintStream out = System.out;
        ProcessJobContext context = new ProcessJobContext(mapper, out);
        if (argv.length != 1) {
            context.emit(error("usage: ProcessWorkerMain <body-class>", "IllegalArgumentException", null));
            System.exit(1);
        }
        try {
            List<Object> args = mapper.readValue(System.in, new TypeReference<List<Object>>() {
            });
            Class<?> type = Class.forName(argv[0]);
            if (!ProcessJobBody.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(argv[0] + " does not implement ProcessJobBody");
            }
            Constructor<?> ctor = type.getDeclaredConstructor();
            ctor.setAccessible(true);
            ProcessJobBody body = (ProcessJobBody) ctor.newInstance();

            Object value = body.run(context, args);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("type", "result");
            result.put("value", value);
            context.emit(result);
            out.flush();
            System.exit(0);
        } catch (Throwable t) {
            StringWriter sw = new StringWriter();
            t.printStackTrace(new PrintWriter(sw));
            context.emit(error(t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage(),
                    t.getClass().getSimpleName(), sw.toString()));
            System.exit(1);
        }
    }

    private static Map<String, Object> error(String message, String type, String trace) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", "error");
        m.put("error", message);
        m.put("errorType", type);
        m.put("exception", trace);
        return m;
    }
}
