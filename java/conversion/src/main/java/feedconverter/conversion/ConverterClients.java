/*
 * Copyright 2022-2024 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package feedconverter.conversion;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3BaseClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.transfer.s3.S3TransferManager;

import feedconverter.conversion.store.ObjectStore;
import feedconverter.conversion.store.S3ObjectStore;

import java.net.URI;
import java.util.Map;

/**
 * Holds the clients a conversion process talks to. Clients are created once per process and passed to whatever needs
 * them. Tests create a context around a fake object store instead.
 */
public class ConverterClients implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConverterClients.class);
    private static final String AWS_ENDPOINT_ENV_VAR = "AWS_ENDPOINT_URL";

    private final ObjectStore objectStore;
    private final S3Client s3Client;
    private final S3AsyncClient s3AsyncClient;
    private final S3TransferManager s3TransferManager;

    public ConverterClients(ObjectStore objectStore) {
        this(objectStore, null, null, null);
    }

    private ConverterClients(ObjectStore objectStore, S3Client s3Client, S3AsyncClient s3AsyncClient, S3TransferManager s3TransferManager) {
        this.objectStore = objectStore;
        this.s3Client = s3Client;
        this.s3AsyncClient = s3AsyncClient;
        this.s3TransferManager = s3TransferManager;
    }

    /**
     * Creates clients for AWS. If the environment variable AWS_ENDPOINT_URL is set, clients are pointed at that
     * endpoint instead, e.g. to run against LocalStack.
     *
     * @return the clients
     */
    public static ConverterClients createDefault() {
        return createFromEnvironment(System.getenv());
    }

    static ConverterClients createFromEnvironment(Map<String, String> environment) {
        String endpoint = environment.get(AWS_ENDPOINT_ENV_VAR);
        S3Client s3Client = buildAwsClient(S3Client.builder(), endpoint);
        S3AsyncClient s3AsyncClient = buildAwsClient(S3AsyncClient.builder().multipartEnabled(true), endpoint);
        S3TransferManager s3TransferManager = S3TransferManager.builder().s3Client(s3AsyncClient).build();
        return new ConverterClients(new S3ObjectStore(s3Client, s3TransferManager),
                s3Client, s3AsyncClient, s3TransferManager);
    }

    private static <B extends AwsClientBuilder<B, T>, T> T buildAwsClient(B builder, String endpoint) {
        if (endpoint == null) {
            return builder.build();
        }
        LOGGER.info("Using AWS endpoint {}", endpoint);
        if (builder instanceof S3BaseClientBuilder) {
            ((S3BaseClientBuilder<?, ?>) builder).forcePathStyle(true);
        }
        return builder
                .endpointOverride(URI.create(endpoint))
                .region(Region.US_EAST_1)
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create("test-access-key", "test-secret-key")))
                .build();
    }

    public ObjectStore getObjectStore() {
        return objectStore;
    }

    @Override
    public void close() {
        if (s3TransferManager != null) {
            s3TransferManager.close();
        }
        if (s3AsyncClient != null) {
            s3AsyncClient.close();
        }
        if (s3Client != null) {
            s3Client.close();
        }
    }
}
