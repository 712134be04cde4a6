package com.skillbox.runtime.sandbox;

import com.skillbox.runtime.skill.Permission;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a spawned skill process may see of the host.
 *
 * The environment is computed once, at construction, from an explicit
 * allow-list. An allow-listed name that still looks sensitive is dropped
 * unless it was configured as an extra, which is the only way to pass a
 * secret-looking variable through.
 */
public final class SandboxPolicy {

    private static final Logger log = LoggerFactory.getLogger(SandboxPolicy.class);

    public static final List<String> DEFAULT_ALLOWED = List.of(
            "PATH", "HOME", "LANG", "LC_ALL", "TZ", "TMPDIR", "TEMP", "TMP", "JAVA_HOME",
            "SystemRoot", "WINDIR", "USERPROFILE", "HOMEPATH");

    public static final List<String> SENSITIVE_PATTERNS = List.of(
            "TOKEN", "KEY", "SECRET", "PASSWORD", "CREDENTIAL", "AUTH", "PIN", "PRIVATE");

    private final Set<String>         allowedNames;
    private final Map<String, String> environment;

    public SandboxPolicy(Collection<String> extraAllowed, Map<String, String> hostEnvironment) {
        Set<String> allowed = new LinkedHashSet<>(DEFAULT_ALLOWED);
        allowed.addAll(extraAllowed);
        this.allowedNames = Collections.unmodifiableSet(allowed);

        Map<String, String> env = new LinkedHashMap<>();
        for (String name : DEFAULT_ALLOWED) {
            String value = hostEnvironment.get(name);
            if (value == null) {
                continue;
            }
            if (isSensitive(name)) {
                log.warn("Dropping sensitive-looking variable {} from the sandbox environment", name);
                continue;
            }
            env.put(name, value);
        }
        for (String name : extraAllowed) {
            String value = hostEnvironment.get(name);
            if (value != null) {
                env.put(name, value);
            }
        }
        this.environment = Collections.unmodifiableMap(env);
        log.info("Sandbox environment: {}", environment.keySet());
    }

    public static boolean isSensitive(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        return SENSITIVE_PATTERNS.stream().anyMatch(upper::contains);
    }

    /** Base environment every spawned skill receives. */
    public Map<String, String> environment() {
        return environment;
    }

    public Set<String> allowedNames() {
        return allowedNames;
    }

    public boolean networkAllowed(Set<Permission> permissions) {
        return permissions.contains(Permission.NETWORK) || permissions.contains(Permission.CREDENTIALS);
    }

    public Set<Capability> deniedCapabilities(Set<Permission> permissions) {
        Set<Capability> denied = EnumSet.allOf(Capability.class);
        if (networkAllowed(permissions)) {
            denied.remove(Capability.RAW_SOCKET);
        }
        return denied;
    }

    /**
     * Full environment for one execution: the base environment plus the
     * {@code SKILLBOX_*} variables describing the run. Never contains secrets.
     */
    public Map<String, String> environmentFor(ExecutionEnvironment run) {
        Map<String, String> env = new LinkedHashMap<>(environment);
        env.put("SKILLBOX_TASK", run.task() == null ? "" : run.task());
        env.put("SKILLBOX_USER_ID", run.userId() == null ? "" : run.userId());
        env.put("SKILLBOX_SESSION_ID", run.sessionId());
        env.put("SKILLBOX_SKILL_ID", run.skillId());
        env.put("SKILLBOX_SANDBOX_DIR", run.sandboxDir().toString());
        env.put("SKILLBOX_OUTPUT_DIR", run.sandboxDir().resolve(SandboxWorkspace.OUTPUT_DIR).toString());
        env.put("SKILLBOX_PERMISSIONS", run.permissions().stream()
                .map(Permission::wireName).sorted().collect(Collectors.joining(",")));
        env.put("SKILLBOX_NETWORK", networkAllowed(run.permissions()) ? "allowed" : "blocked");
        env.put("SKILLBOX_DENIED_CAPABILITIES", deniedCapabilities(run.permissions()).stream()
                .map(Capability::wireName).collect(Collectors.joining(",")));
        return env;
    }
}
