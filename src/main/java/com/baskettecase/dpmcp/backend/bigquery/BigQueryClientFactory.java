package com.baskettecase.dpmcp.backend.bigquery;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Builds the BigQuery client used by {@link BigQueryBackendManager}.
 */
@FunctionalInterface
public interface BigQueryClientFactory {

    BigQuery create(String projectId, String serviceAccountJsonPath, String location) throws IOException;

    /**
     * Service-account credentials when a key file is given, Application Default Credentials otherwise.
     */
    static BigQueryClientFactory standard() {
        return (projectId, serviceAccountJsonPath, location) -> {
            BigQueryOptions.Builder builder = BigQueryOptions.newBuilder().setProjectId(projectId);
            if (serviceAccountJsonPath != null) {
                try (InputStream keyFile = new FileInputStream(serviceAccountJsonPath)) {
                    builder.setCredentials(ServiceAccountCredentials.fromStream(keyFile));
                }
            } else {
                builder.setCredentials(GoogleCredentials.getApplicationDefault());
            }
            if (location != null) {
                builder.setLocation(location);
            }
            return builder.build().getService();
        };
    }
}
