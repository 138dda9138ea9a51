package com.tba3.mock.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "tba3")
public record Tba3Properties(@DefaultValue("metadata") Path metadataDir,
                             @DefaultValue("config") Path configDir) {}
