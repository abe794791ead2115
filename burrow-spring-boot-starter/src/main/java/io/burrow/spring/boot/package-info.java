/**
 * Spring Boot auto-configuration for burrow messaging, bound from {@code burrow.*} properties.
 */
package io.burrow.spring.boot;
