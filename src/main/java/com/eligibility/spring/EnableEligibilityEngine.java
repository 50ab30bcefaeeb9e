package com.eligibility.spring;

import com.eligibility.adapter.spring.EligibilityAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the eligibility engine in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableEligibilityEngine
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 * The application supplies a {@code FactProvider} bean and, optionally, an
 * {@code AiReasoningProvider} bean.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(EligibilityAutoConfiguration.class)
public @interface EnableEligibilityEngine {
}
