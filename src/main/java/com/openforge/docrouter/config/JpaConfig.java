package com.openforge.docrouter.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Activates Spring Data JPA Auditing so that @CreatedDate / @LastModifiedDate
 * on BaseEntity are populated for every knowledge table.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
