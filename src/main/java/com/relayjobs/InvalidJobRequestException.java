package com.relayjobs;

import java.util.List;
import java.util.Map;

public class InvalidJobRequestException extends RelayException {
    private final List<String> problems;

    public InvalidJobRequestException(List<String> problems) {
        super(ErrorCode.INVALID_REQUEST, "Invalid job request: " + String.join("; ", problems),
            Map.of("problems", List.copyOf(problems)), null);
        this.problems = List.copyOf(problems);
    }

    public InvalidJobRequestException(String problem, Throwable cause) {
        super(ErrorCode.INVALID_REQUEST, "Invalid job request: " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}
