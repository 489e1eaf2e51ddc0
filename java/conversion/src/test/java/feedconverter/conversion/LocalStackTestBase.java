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
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.containers.localstack.LocalStackContainer.Service;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.S3Object;

import feedconverter.conversion.store.ObjectStore;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * A base class for tests to run against S3 in LocalStack. One container is shared by all tests in the JVM.
 */
public abstract class LocalStackTestBase {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStackTestBase.class);
    public static final String LOCALSTACK_DOCKER_IMAGE = "localstack/localstack:4.0.3";

    protected static final LocalStackContainer CONTAINER = start();
    protected static final S3Client S3_CLIENT = buildS3Client();
    protected static final ConverterClients CLIENTS = ConverterClients.createFromEnvironment(
            Map.of("AWS_ENDPOINT_URL", CONTAINER.getEndpoint().toString()));

    protected final ObjectStore objectStore = CLIENTS.getObjectStore();

    private static LocalStackContainer start() {
        LocalStackContainer container = new LocalStackContainer(DockerImageName.parse(LOCALSTACK_DOCKER_IMAGE))
                .withServices(Service.S3)
                .withLogConsumer(outputFrame -> LOGGER.info(outputFrame.getUtf8StringWithoutLineEnding()));
        container.start();
        return container;
    }

    private static S3Client buildS3Client() {
        return S3Client.builder()
                .endpointOverride(CONTAINER.getEndpoint())
                .forcePathStyle(true)
                .region(Region.of(CONTAINER.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(CONTAINER.getAccessKey(), CONTAINER.getSecretKey())))
                .build();
    }

    public static String createBucket() {
        String bucketName = UUID.randomUUID().toString();
        S3_CLIENT.createBucket(builder -> builder.bucket(bucketName));
        return bucketName;
    }

    public static void putObject(String bucketName, String key, byte[] content) {
        S3_CLIENT.putObject(builder -> builder.bucket(bucketName).key(key), RequestBody.fromBytes(content));
    }

    public static byte[] getObject(String bucketName, String key) {
        return S3_CLIENT.getObject(builder -> builder.bucket(bucketName).key(key), ResponseTransformer.toBytes())
                .asByteArray();
    }

    public static List<String> listObjectKeys(String bucketName) {
        return S3_CLIENT.listObjectsV2Paginator(builder -> builder.bucket(bucketName))
                .contents().stream().map(S3Object::key)
                .sorted()
                .collect(Collectors.toList());
    }
}
