/**
 * Spring Boot auto-configuration binding {@code mailsched.*} properties to a
 * {@link mailsched.MailSchedulePipeline}.
 */
package mailsched.spring.boot;
