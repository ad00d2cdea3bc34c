package io.swarmmesh.agent;

import java.util.List;

/**
 * What an agent can do, as advertised to peers and used to decide collaboration and delegation.
 */
public record AgentCapabilities(
        boolean canCoordinate,
        boolean canExecuteCode,
        boolean canAnalyzeRequirements,
        boolean canReview,
        boolean canOptimize,
        boolean canTest,
        boolean canDocument,
        boolean canDeploy,
        List<String> specializedSkills,
        List<String> domains,
        List<String> languages,
        List<String> frameworks,
        List<String> tools,
        int maxComplexity,
        int parallelTasks,
        String collaborationStyle
) {
    public static final int DEFAULT_MAX_COMPLEXITY = 5;

    public AgentCapabilities {
        specializedSkills = specializedSkills == null ? List.of() : List.copyOf(specializedSkills);
        domains = domains == null ? List.of() : List.copyOf(domains);
        languages = languages == null ? List.of() : List.copyOf(languages);
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
        tools = tools == null ? List.of() : List.copyOf(tools);
        if (maxComplexity < 1) {
            throw new IllegalArgumentException("maxComplexity must be >= 1");
        }
        parallelTasks = Math.max(1, parallelTasks);
        collaborationStyle = collaborationStyle == null || collaborationStyle.isBlank()
                ? "cooperative"
                : collaborationStyle.trim();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean canCoordinate;
        private boolean canExecuteCode;
        private boolean canAnalyzeRequirements;
        private boolean canReview;
        private boolean canOptimize;
        private boolean canTest;
        private boolean canDocument;
        private boolean canDeploy;
        private List<String> specializedSkills = List.of();
        private List<String> domains = List.of();
        private List<String> languages = List.of();
        private List<String> frameworks = List.of();
        private List<String> tools = List.of();
        private int maxComplexity = DEFAULT_MAX_COMPLEXITY;
        private int parallelTasks = 1;
        private String collaborationStyle = "cooperative";

        private Builder() {
        }

        public Builder canCoordinate(boolean value) {
            this.canCoordinate = value;
            return this;
        }

        public Builder canExecuteCode(boolean value) {
            this.canExecuteCode = value;
            return this;
        }

        public Builder canAnalyzeRequirements(boolean value) {
            this.canAnalyzeRequirements = value;
            return this;
        }

        public Builder canReview(boolean value) {
            this.canReview = value;
            return this;
        }

        public Builder canOptimize(boolean value) {
            this.canOptimize = value;
            return this;
        }

        public Builder canTest(boolean value) {
            this.canTest = value;
            return this;
        }

        public Builder canDocument(boolean value) {
            this.canDocument = value;
            return this;
        }

        public Builder canDeploy(boolean value) {
            this.canDeploy = value;
            return this;
        }

        public Builder specializedSkills(List<String> value) {
            this.specializedSkills = value;
            return this;
        }

        public Builder domains(List<String> value) {
            this.domains = value;
            return this;
        }

        public Builder languages(List<String> value) {
            this.languages = value;
            return this;
        }

        public Builder frameworks(List<String> value) {
            this.frameworks = value;
            return this;
        }

        public Builder tools(List<String> value) {
            this.tools = value;
            return this;
        }

        public Builder maxComplexity(int value) {
            this.maxComplexity = value;
            return this;
        }

        public Builder parallelTasks(int value) {
            this.parallelTasks = value;
            return this;
        }

        public Builder collaborationStyle(String value) {
            this.collaborationStyle = value;
            return this;
        }

        public AgentCapabilities build() {
            return new AgentCapabilities(
                    canCoordinate,
                    canExecuteCode,
                    canAnalyzeRequirements,
                    canReview,
                    canOptimize,
                    canTest,
                    canDocument,
                    canDeploy,
                    specializedSkills,
                    domains,
                    languages,
                    frameworks,
                    tools,
                    maxComplexity,
                    parallelTasks,
                    collaborationStyle
            );
        }
    }
}
