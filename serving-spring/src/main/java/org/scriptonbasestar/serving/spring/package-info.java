/**
 * 서빙 인프라 조립: {@link org.scriptonbasestar.serving.spring.ServingContext}와 Spring Boot 연동
 *
 * @since 2026-10
 */
package org.scriptonbasestar.serving.spring;
