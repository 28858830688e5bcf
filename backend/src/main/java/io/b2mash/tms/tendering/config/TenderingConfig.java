package io.b2mash.tms.tendering.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TenderingProperties.class)
public class TenderingConfig {}
