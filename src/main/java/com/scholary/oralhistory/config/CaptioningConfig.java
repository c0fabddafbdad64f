package com.scholary.oralhistory.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables binding of the captioning and NER polishing settings. */
@Configuration
@EnableConfigurationProperties({CaptioningProperties.class, NerProperties.class})
public class CaptioningConfig {}
