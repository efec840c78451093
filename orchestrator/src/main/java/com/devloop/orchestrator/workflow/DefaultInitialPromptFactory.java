package com.devloop.orchestrator.workflow;

import org.springframework.stereotype.Component;

/**
 * Task description plus the commit-and-open-a-PR workflow the completion monitor watches for.
 */
@Component
public class DefaultInitialPromptFactory implements InitialPromptFactory {

    @Override
    public String buildInitialPrompt(PlannedChange change, ProjectInfo project) {
        String baseBranch = change.baseBranch() != null ? change.baseBranch()
                : project != null && project.defaultBranch() != null ? project.defaultBranch()
                : "main";
        String shortTitle = change.shortTitle() != null ? change.shortTitle() : change.title();

        StringBuilder prompt = new StringBuilder()
                .append("Please implement the following change:\n\n")
                .append("**Title:** ").append(change.title()).append('\n')
                .append("**Branch:** ").append(change.branchName());

        if (change.description() != null && !change.description().isBlank()) {
            prompt.append("\n\n**Description:** ").append(change.description());
        }
        if (change.instructions() != null && !change.instructions().isBlank()) {
            prompt.append("\n\n**Instructions:**\n").append(change.instructions());
        }

        prompt.append("\n\n## Workflow Instructions\n\n")
              .append("1. Implement the change described above\n")
              .append("2. Write tests for your implementation where appropriate\n")
              .append("3. Commit your changes to the current branch (").append(change.branchName()).append(")\n")
              .append("4. When complete, create a pull request using the following command:\n")
              .append("   ```\n")
              .append("   gh pr create --base ").append(baseBranch)
              .append(" --title \"").append(change.title()).append("\"")
              .append(" --body \"Implements ").append(shortTitle).append("\"\n")
              .append("   ```\n\n")
              .append("**Important:** After creating the PR, signal completion so the system can verify and track the PR.");
        return prompt.toString();
    }
}
