package io.middleware4j.service;

import io.middleware4j.core.EventType;
import io.middleware4j.core.ExecutionMode;
import io.middleware4j.core.QueryOptions;
import io.middleware4j.errors.InstanceNotFoundException;
import io.middleware4j.errors.MiddlewareException;
import io.middleware4j.job.Job;
import io.middleware4j.job.JobOptions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in {@code core} namespace: job introspection and control, bulk calls, and registry introspection.
 */
public class CoreService extends Service {

    public static final String NAMESPACE = "core";

    public CoreService() {
        super(ServiceDescriptor.builder(NAMESPACE).eventRegister(false).eventSend(false).build());
    }

    @Override
    public List<MethodDescriptor> methods() {
        return List.of(
                MethodDescriptor.builder("ping", (job, args) -> "pong").build(),
                MethodDescriptor.builder("get_jobs", (job, args) -> middleware().jobs().query(
                        CrudService.filtersArg(arg(args, 0)),
                        QueryOptions.fromMap(mapArg(args, 1, "options"))).value()).build(),
                MethodDescriptor.builder("job_wait", (job, args) -> job.wrap(jobArg(args)))
                        .job(JobOptions.builder().mode(ExecutionMode.THREAD).build()).build(),
                MethodDescriptor.builder("job_update", (job, args) -> jobUpdate(jobArg(args), mapArg(args, 1, "data")))
                        .build(),
                MethodDescriptor.builder("job_abort", (job, args) -> {
                    jobArg(args).abort();
                    return null;
                }).build(),
                MethodDescriptor.builder("bulk", this::bulk)
                        .job(JobOptions.builder()
                                .mode(ExecutionMode.THREAD)
                                .lock(a -> "bulk:" + a.get(0))
                                .description(a -> "Bulk call of " + a.get(0))
                                .build())
                        .build(),
                MethodDescriptor.builder("get_services", (job, args) -> getServices()).build(),
                MethodDescriptor.builder("get_methods", (job, args) -> getMethods(
                        arg(args, 0) == null ? null : String.valueOf(arg(args, 0)))).build(),
                MethodDescriptor.builder("call_hook", (job, args) -> hooks().run(String.valueOf(arg(args, 0)),
                        args.size() > 1 ? new ArrayList<>(args.subList(1, args.size())) : new ArrayList<>()))
                        .privateMethod(true).build(),
                MethodDescriptor.builder("event_send", (job, args) -> {
                    Map<String, Object> fields = mapArg(args, 2, "fields");
                    events().send(String.valueOf(arg(args, 0)), EventType.valueOf(String.valueOf(arg(args, 1))),
                            fields.get("id"), fields);
                    return null;
                }).privateMethod(true).build()
        );
    }

    private Job jobArg(List<Object> args) {
        Object raw = arg(args, 0);
        if (!(raw instanceof Number n)) {
            throw new InstanceNotFoundException("Job " + raw + " does not exist");
        }
        return middleware().jobs().get(n.longValue())
                .orElseThrow(() -> new InstanceNotFoundException("Job " + raw + " does not exist"));
    }

    private Object jobUpdate(Job job, Map<String, Object> data) {
        Object progress = data.get("progress");
        if (progress instanceof Map<?, ?> p) {
            Object percent = p.get("percent");
            Object description = p.get("description");
            job.setProgress(percent instanceof Number n ? n.doubleValue() : null,
                    description == null ? null : String.valueOf(description),
                    p.get("extra"));
        }
        return null;
    }

    /**
     * Call {@code method} once per parameter list. Never fails as a whole: every call gets a status with its
     * result or error, and job-backed calls are awaited.
     */
    private Object bulk(Job job, List<Object> args) throws InterruptedException {
        String method = String.valueOf(arg(args, 0));
        Object raw = arg(args, 1);
        List<?> params = raw instanceof List<?> l ? l : List.of();

        List<Map<String, Object>> statuses = new ArrayList<>();
        int done = 0;
        for (Object p : params) {
            List<Object> callArgs = p instanceof List<?> l ? new ArrayList<>(l) : new ArrayList<>(List.of(p));
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("job_id", null);
            status.put("result", null);
            status.put("error", null);
            try {
                Object result = middleware().callArgs(method, callArgs);
                if (result instanceof Job sub) {
                    status.put("job_id", sub.id());
                    result = sub.await();
                }
                status.put("result", result);
            } catch (MiddlewareException e) {
                status.put("error", e.getMessage());
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                status.put("error", String.valueOf(e.getMessage()));
            }
            statuses.add(status);
            done++;
            job.setProgress(100.0 * done / Math.max(1, params.size()), done + "/" + params.size());
        }
        return statuses;
    }

    private Map<String, Object> getServices() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Service service : context().registry().all()) {
            ServiceDescriptor d = service.descriptor();
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("datastore", d.datastore());
            config.put("datastore_prefix", d.datastorePrefix());
            config.put("datastore_primary_key", d.primaryKey());
            config.put("event_register", d.eventRegister());
            config.put("event_send", d.eventSend());
            config.put("private", d.privateService());
            config.put("verbose_name", d.verboseName());
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("config", config);
            entry.put("type", service.type().name().toLowerCase());
            out.put(service.namespace(), entry);
        }
        return out;
    }

    private Map<String, Object> getMethods(String namespace) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ServiceRegistry.ResolvedMethod m : context().registry().methods()) {
            if (namespace != null && !m.service().namespace().equals(namespace)) {
                continue;
            }
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("private", m.isPrivate());
            info.put("item_method", m.method().itemMethod());
            info.put("job", m.method().isJob());
            info.put("abortable", m.method().isJob() && m.method().job().abortable());
            info.put("pipes", m.method().isJob()
                    ? m.method().job().pipes().stream().map(k -> k.name().toLowerCase()).sorted().toList()
                    : List.of());
            out.put(m.fullName(), info);
        }
        return out;
    }
}
