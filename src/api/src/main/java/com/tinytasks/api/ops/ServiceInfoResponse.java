package com.tinytasks.api.ops;

public record ServiceInfoResponse(String service, String version) {
}
