package dev.pekelund.medinterp.reportservice;

import com.google.cloud.ServiceOptions;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.springframework.util.StringUtils;

/**
 * Firestore location for accepted interpretation results, resolved from the process environment.
 */
public record ReportServiceSettings(
    String projectId,
    String databaseId,
    String resultsCollection
) {

    public static final String DEFAULT_RESULTS_COLLECTION = "interpretedReports";
    public static final String DEFAULT_DATABASE_ID = "(default)";

    private static final String DEFAULT_LOCAL_PROJECT_ID = "medinterp-local";

    public static ReportServiceSettings fromEnvironment() {
        return fromEnvironment(System.getenv(), ServiceOptions::getDefaultProjectId);
    }

    static ReportServiceSettings fromEnvironment(Map<String, String> env, Supplier<String> defaultProjectSupplier) {
        Objects.requireNonNull(env, "env");
        Objects.requireNonNull(defaultProjectSupplier, "defaultProjectSupplier");

        String collection = firstNonEmpty(env.get("REPORT_FIRESTORE_COLLECTION"), DEFAULT_RESULTS_COLLECTION);
        String databaseId = firstNonEmpty(env.get("FIRESTORE_DATABASE_ID"), env.get("FIRESTORE_DATABASE_NAME"),
            DEFAULT_DATABASE_ID);
        String projectId = firstNonEmpty(
            env.get("PROJECT_ID"),
            env.get("FIRESTORE_PROJECT_ID"),
            env.get("GOOGLE_CLOUD_PROJECT"),
            env.get("GCLOUD_PROJECT"),
            env.get("GCP_PROJECT"),
            defaultProjectSupplier.get());

        String localProjectId = env.getOrDefault("LOCAL_PROJECT_ID", DEFAULT_LOCAL_PROJECT_ID);
        if (StringUtils.hasText(localProjectId) && localProjectId.equals(projectId) && isRunningOnCloudRun(env)) {
            throw new IllegalStateException(String.format("Firestore project id resolved to local project '%s' while"
                + " running on Cloud Run. Update the deployment environment to use the production project id.",
                projectId));
        }
        if (!StringUtils.hasText(projectId)) {
            throw new IllegalStateException("Firestore project id must be configured via PROJECT_ID "
                + "or available from the Cloud environment.");
        }
        return new ReportServiceSettings(projectId, databaseId, collection);
    }

    private static boolean isRunningOnCloudRun(Map<String, String> env) {
        return StringUtils.hasText(env.get("K_SERVICE"));
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
