package org.scriptonbasestar.serving.spring.boot;

import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Enables the serving infrastructure without relying on auto-configuration discovery.
 *
 * <pre>{@code
 * @SpringBootApplication
 * @EnableServingInfra
 * public class Application {
 * }
 * }</pre>
 *
 * @since 2026-10
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(ServingAutoConfiguration.class)
public @interface EnableServingInfra {
}
