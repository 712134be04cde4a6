package com.skillbox.runtime.api;

import com.skillbox.runtime.api.dto.InstallResponse;
import com.skillbox.runtime.api.dto.QuarantineView;
import com.skillbox.runtime.api.dto.RunSkillRequest;
import com.skillbox.runtime.api.dto.SkillView;
import com.skillbox.runtime.api.dto.SkillsResponse;
import com.skillbox.runtime.gate.InstallResult;
import com.skillbox.runtime.gate.SkillVault;
import com.skillbox.runtime.gate.StagedSubmission;
import com.skillbox.runtime.lifecycle.ExecutionSnapshot;
import com.skillbox.runtime.lifecycle.SkillLifecycleManager;
import com.skillbox.runtime.lifecycle.SkillRunResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * REST API for skills and their executions.
 *
 * GET    /skills                  - resolvable names and installed skills
 * DELETE /skills/{id}             - remove a live skill
 * POST   /skills/{name}/runs      - execute a skill and wait for its result
 * POST   /retries/{sessionId}     - re-run a failed execution
 * GET    /executions              - executions currently tracked
 * DELETE /executions/{handle}     - terminate an execution
 * POST   /submissions             - upload a skill archive (multipart "file")
 * GET    /quarantine              - rejected submissions
 */
@RestController
public class SkillController {

    private final SkillLifecycleManager lifecycleManager;
    private final SkillVault            skillVault;

    public SkillController(SkillLifecycleManager lifecycleManager, SkillVault skillVault) {
        this.lifecycleManager = lifecycleManager;
        this.skillVault       = skillVault;
    }

    @GetMapping("/skills")
    public SkillsResponse listSkills() {
        return new SkillsResponse(
                new ArrayList<>(lifecycleManager.listAvailableSkills()),
                skillVault.listInstalled().stream().map(SkillView::from).toList());
    }

    @DeleteMapping("/skills/{id}")
    public ResponseEntity<Void> deleteSkill(@PathVariable String id) {
        if (!skillVault.deleteSkill(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Skill not found: " + id);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Run a skill to completion.
     *
     * Always 200: failures (unknown skill, timeout, skill error) are reported
     * in the body with success=false and, when retryable, a session id for
     * POST /retries/{sessionId}.
     *
     * Example:
     *   curl -X POST http://localhost:8080/skills/summarize/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"task":"summarize today","userId":"u-42","timeoutSec":30}'
     */
    @PostMapping("/skills/{name}/runs")
    public SkillRunResult run(@PathVariable String name, @RequestBody RunSkillRequest req) {
        Duration timeout = req.timeoutSec() == null ? null : Duration.ofSeconds(req.timeoutSec());
        return lifecycleManager.useAndKill(name, req.task(), timeout, req.userId());
    }

    @PostMapping("/retries/{sessionId}")
    public SkillRunResult retry(@PathVariable String sessionId) {
        return lifecycleManager.retry(sessionId);
    }

    @GetMapping("/executions")
    public List<ExecutionSnapshot> executions() {
        return lifecycleManager.activeExecutions();
    }

    @DeleteMapping("/executions/{handle}")
    public ResponseEntity<Void> kill(@PathVariable long handle) {
        if (!lifecycleManager.kill(handle)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Execution not found: " + handle);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Stage, validate and install an archive.
     *
     * HTTP 201 - promoted to live
     * HTTP 422 - rejected and quarantined; reasons in the body
     */
    @PostMapping("/submissions")
    public ResponseEntity<InstallResponse> submit(@RequestParam("file") MultipartFile file,
                                                  @RequestParam(value = "submitterId", defaultValue = "anonymous")
                                                  String submitterId) {
        if (file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Empty upload");
        }
        StagedSubmission staged;
        try (InputStream in = file.getInputStream()) {
            staged = skillVault.stage(in, file.getOriginalFilename(), submitterId);
        } catch (IOException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unreadable upload: " + e.getMessage(), e);
        }
        InstallResult result = skillVault.validateAndInstall(staged);
        HttpStatus status = result.ok() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(InstallResponse.from(result));
    }

    @GetMapping("/quarantine")
    public List<QuarantineView> quarantine() {
        return skillVault.listQuarantine().stream().map(QuarantineView::from).toList();
    }
}
