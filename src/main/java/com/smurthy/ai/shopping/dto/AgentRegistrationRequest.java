package com.smurthy.ai.shopping.dto;

import java.util.Set;

public record AgentRegistrationRequest(String name, String description, Set<String> capabilities) {
}
