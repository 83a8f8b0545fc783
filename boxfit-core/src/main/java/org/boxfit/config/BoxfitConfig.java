package org.boxfit.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Entry point for host applications: {@code @Import(BoxfitConfig.class)} registers the
 * raster engine, the resize pipeline and the exporter.
 */
@Configuration
@ComponentScan(basePackages = "org.boxfit")
@EnableConfigurationProperties
public class BoxfitConfig {
}
