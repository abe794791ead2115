/**
 * Operation timing and outcome reporting.
 */
package io.burrow.telemetry;
