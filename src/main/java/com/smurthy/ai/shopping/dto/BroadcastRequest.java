package com.smurthy.ai.shopping.dto;

import java.util.List;

public record BroadcastRequest(String message, List<String> exclude) {
}
