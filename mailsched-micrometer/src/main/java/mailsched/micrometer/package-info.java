/**
 * Micrometer binding for {@link mailsched.spi.MetricsExporter}.
 */
package mailsched.micrometer;
