/**
 * Spring Boot auto-configuration for the retry engine.
 */
package io.requeue.spring.boot;
