/**
 * Message publishing, single and batched.
 */
package io.burrow.publish;
