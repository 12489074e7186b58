package com.fun.compute.api.model;

import java.util.List;
import java.util.Map;

public record RebuildCommand(
        String imageRef,
        String adminPassword,
        String name,
        Map<String, String> metadata,
        List<InjectedFile> injectedFiles
) {
}
