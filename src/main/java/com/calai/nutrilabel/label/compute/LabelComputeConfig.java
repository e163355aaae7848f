package com.calai.nutrilabel.label.compute;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(LabelProperties.class)
public class LabelComputeConfig {
}
