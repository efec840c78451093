package com.devloop.orchestrator.vcs;

import com.devloop.orchestrator.workflow.ProjectInfo;
import com.devloop.orchestrator.workflow.WorktreeProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Worktrees under {@code <repo>/.worktrees/<sanitized-branch>}, created with the {@code git} CLI.
 */
public class GitWorktreeProvisioner implements WorktreeProvisioner {

    private static final Logger log = LoggerFactory.getLogger(GitWorktreeProvisioner.class);

    private final CommandRunner commands;

    public GitWorktreeProvisioner(CommandRunner commands) {
        this.commands = commands;
    }

    @Override
    public Optional<String> ensureWorktree(ProjectInfo project, String branchName, String baseBranch) {
        Path repo = Path.of(project.localPath());
        Path worktree = repo.resolve(".worktrees").resolve(sanitizeBranchName(branchName));
        if (Files.isDirectory(worktree)) {
            return Optional.of(worktree.toString());
        }

        String baseRef = baseBranch != null ? baseBranch : "HEAD";
        CommandResult branch = commands.run(repo, "git", "branch", branchName, baseRef);
        if (!branch.success() && !branch.error().contains("already exists")) {
            log.error("git branch {} {} failed in {}: {}", branchName, baseRef, repo, branch.error().strip());
            return Optional.empty();
        }

        CommandResult added = commands.run(repo, "git", "worktree", "add", worktree.toString(), branchName);
        if (!added.success()) {
            log.error("git worktree add {} failed in {}: {}", worktree, repo, added.error().strip());
            return Optional.empty();
        }
        log.info("Created worktree {} for branch {}", worktree, branchName);
        return Optional.of(worktree.toString());
    }

    @Override
    public boolean pullLatest(String worktreePath) {
        CommandResult pulled = commands.run(Path.of(worktreePath), "git", "pull", "--ff-only");
        if (!pulled.success()) {
            log.warn("git pull in {} failed: {}", worktreePath, pulled.error().strip());
        }
        return pulled.success();
    }

    static String sanitizeBranchName(String branchName) {
        String sanitized = branchName.replaceAll("[/\\\\@#\\s]+", "-")
                .replaceAll("[^a-zA-Z0-9\\-_.]", "-")
                .replaceAll("-+", "-");
        return sanitized.replaceAll("^-+|-+$", "");
    }
}
