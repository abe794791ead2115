/**
 * Payload encodings: JSON and MessagePack, both through Jackson.
 */
package io.burrow.serialization;
