/**
 * Spring Boot auto-configuration for kvloader.
 *
 * <p>Binds {@code kvloader.*} properties and registers a shared task runner, a source
 * factory and, when Micrometer is present, a metrics exporter.
 */
package kvloader.spring.boot;
