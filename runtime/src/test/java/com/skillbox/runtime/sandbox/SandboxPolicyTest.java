package com.skillbox.runtime.sandbox;

import com.skillbox.runtime.skill.Permission;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SandboxPolicy}.
 * No Spring context: all wiring is done manually.
 */
class SandboxPolicyTest {

    static final Map<String, String> HOST = Map.of(
            "PATH", "/usr/bin:/bin",
            "HOME", "/home/runner",
            "AWS_SECRET_ACCESS_KEY", "shh",
            "GITHUB_TOKEN", "ghp_x",
            "DATABASE_URL", "postgres://db",
            "SKILL_REGION", "eu-west-1");

    // ------------------------------------------------------------------
    // Base environment
    // ------------------------------------------------------------------

    @Test
    void environment_keepsOnlyAllowListedVariables() {
        SandboxPolicy policy = new SandboxPolicy(List.of(), HOST);

        assertThat(policy.environment())
                .containsOnly(Map.entry("PATH", "/usr/bin:/bin"), Map.entry("HOME", "/home/runner"));
    }

    @Test
    void environment_explicitExtrasPassThroughEvenIfSensitiveLooking() {
        SandboxPolicy policy = new SandboxPolicy(List.of("SKILL_REGION", "GITHUB_TOKEN", "NOT_SET"), HOST);

        assertThat(policy.environment())
                .containsEntry("SKILL_REGION", "eu-west-1")
                .containsEntry("GITHUB_TOKEN", "ghp_x")
                .doesNotContainKeys("NOT_SET", "AWS_SECRET_ACCESS_KEY", "DATABASE_URL");
        assertThat(policy.allowedNames()).contains("PATH", "SKILL_REGION", "NOT_SET");
    }

    @Test
    void environment_isImmutable() {
        SandboxPolicy policy = new SandboxPolicy(List.of(), HOST);

        assertThatThrownBy(() -> policy.environment().put("X", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void isSensitive_matchesCaseInsensitively() {
        assertThat(SandboxPolicy.isSensitive("api_key")).isTrue();
        assertThat(SandboxPolicy.isSensitive("OAUTH_CLIENT")).isTrue();
        assertThat(SandboxPolicy.isSensitive("LANG")).isFalse();
    }

    // ------------------------------------------------------------------
    // Per-execution environment
    // ------------------------------------------------------------------

    @Test
    void environmentFor_noNetworkPermission_blocksNetworkAndDeniesRawSockets() {
        SandboxPolicy policy = new SandboxPolicy(List.of(), HOST);
        ExecutionEnvironment run = new ExecutionEnvironment("s1", "sess-1", "do it", "alice",
                Path.of("/data/sandbox/s1_sess1"), Set.of(Permission.FS_WRITE, Permission.FS_READ));

        Map<String, String> env = policy.environmentFor(run);

        assertThat(env)
                .containsEntry("PATH", "/usr/bin:/bin")
                .containsEntry("SKILLBOX_TASK", "do it")
                .containsEntry("SKILLBOX_USER_ID", "alice")
                .containsEntry("SKILLBOX_SESSION_ID", "sess-1")
                .containsEntry("SKILLBOX_SKILL_ID", "s1")
                .containsEntry("SKILLBOX_PERMISSIONS", "fs_read,fs_write")
                .containsEntry("SKILLBOX_NETWORK", "blocked")
                .doesNotContainKey("AWS_SECRET_ACCESS_KEY");
        assertThat(env.get("SKILLBOX_DENIED_CAPABILITIES")).contains("raw_socket", "process_exec");
        assertThat(env.get("SKILLBOX_OUTPUT_DIR")).endsWith("output");
    }

    @Test
    void deniedCapabilities_credentialsPermissionAllowsNetworkOnly() {
        SandboxPolicy policy = new SandboxPolicy(List.of(), HOST);

        assertThat(policy.networkAllowed(Set.of(Permission.CREDENTIALS))).isTrue();
        assertThat(policy.deniedCapabilities(Set.of(Permission.CREDENTIALS)))
                .containsExactlyInAnyOrder(Capability.PROCESS_EXEC, Capability.DYNAMIC_IMPORT,
                        Capability.CREDENTIAL_STORE);
    }
}
