/**
 * {@link com.vigil.health.HealthCheck} adapters that probe remote HTTP APIs with the JDK
 * {@link java.net.http.HttpClient}.
 */
package com.vigil.health.http;
