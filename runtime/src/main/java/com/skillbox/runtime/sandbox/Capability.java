package com.skillbox.runtime.sandbox;

import java.util.List;

/**
 * Dangerous capabilities a sandboxed skill is denied, with the source
 * markers the validator rejects for each. Markers are plain substrings and
 * cover the script languages the runtime launches plus Java sources.
 */
public enum Capability {
    PROCESS_EXEC("process_exec", List.of(
            "subprocess", "os.system", "os.popen", "os.exec", "Runtime.getRuntime()",
            "ProcessBuilder", "child_process", "exec(")),
    DYNAMIC_IMPORT("dynamic_import", List.of(
            "eval(", "__import__", "importlib", "import inspect", "Class.forName",
            "URLClassLoader", "new Function(")),
    RAW_SOCKET("raw_socket", List.of(
            "socket", "urllib", "http.client", "requests.", "java.net.", "HttpClient",
            "fetch(", "curl ", "wget ", "/dev/tcp/")),
    CREDENTIAL_STORE("credential_store", List.of(
            "keyring", "getpass", "win32cred", "find-generic-password", "KeyStore.getInstance"));

    private final String       wireName;
    private final List<String> markers;

    Capability(String wireName, List<String> markers) {
        this.wireName = wireName;
        this.markers  = markers;
    }

    public String wireName() {
        return wireName;
    }

    public List<String> markers() {
        return markers;
    }
}
