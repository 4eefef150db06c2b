/**
 * Evidence records, envelopes, bundles and the verification report.
 *
 * <p>Generated value classes use JDK collections so Jackson can bind them without extra modules.
 */
@Value.Style(jdkOnly = true)
package dev.evidence.model;

import org.immutables.value.Value;
