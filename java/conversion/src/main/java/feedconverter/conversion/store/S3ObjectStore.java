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
package feedconverter.conversion.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.async.AsyncRequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.transfer.s3.S3TransferManager;
import software.amazon.awssdk.transfer.s3.model.Upload;

import feedconverter.core.util.NumberFormatUtils;

import java.util.List;
import java.util.stream.Collectors;

/**
 * An object store backed by S3. Uploads go through the transfer manager, which splits large objects into multipart
 * uploads. Written objects are owned by the bucket owner, as the destination bucket may belong to another account.
 */
public class S3ObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStore.class);

    private final S3Client s3Client;
    private final S3TransferManager s3TransferManager;

    public S3ObjectStore(S3Client s3Client, S3TransferManager s3TransferManager) {
        this.s3Client = s3Client;
        this.s3TransferManager = s3TransferManager;
    }

    @Override
    public byte[] get(String bucket, String key) {
        try {
            return s3Client.getObject(request -> request.bucket(bucket).key(key),
                    ResponseTransformer.toBytes())
                    .asByteArray();
        } catch (NoSuchKeyException e) {
            throw new ObjectNotFoundException(bucket, key, e);
        }
    }

    @Override
    public void put(String bucket, String key, byte[] data) {
        Upload upload = s3TransferManager.upload(request -> request
                .putObjectRequest(put -> put
                        .bucket(bucket)
                        .key(key)
                        .acl(ObjectCannedACL.BUCKET_OWNER_FULL_CONTROL))
                .requestBody(AsyncRequestBody.fromBytes(data)));
        upload.completionFuture().join();
        LOGGER.info("Wrote {} to bucket {}, object key {}", NumberFormatUtils.formatBytes(data.length), bucket, key);
    }

    @Override
    public void copy(String sourceBucket, String sourceKey, String destinationBucket, String destinationKey) {
        try {
            s3Client.copyObject(request -> request
                    .sourceBucket(sourceBucket)
                    .sourceKey(sourceKey)
                    .destinationBucket(destinationBucket)
                    .destinationKey(destinationKey)
                    .acl(ObjectCannedACL.BUCKET_OWNER_FULL_CONTROL));
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new ObjectNotFoundException(sourceBucket, sourceKey, e);
            }
            throw e;
        }
        LOGGER.info("Copied {} from bucket {} to {} in bucket {}", sourceKey, sourceBucket, destinationKey, destinationBucket);
    }

    @Override
    public List<String> listKeys(String bucket, String prefix, String suffix) {
        return s3Client.listObjectsV2Paginator(request -> request.bucket(bucket).prefix(prefix))
                .contents().stream()
                .map(S3Object::key)
                .filter(key -> key.endsWith(suffix))
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public List<String> listDirectories(String bucket, String prefix) {
        return s3Client.listObjectsV2Paginator(request -> request.bucket(bucket).prefix(prefix).delimiter("/"))
                .commonPrefixes().stream()
                .map(CommonPrefix::prefix)
                .sorted()
                .collect(Collectors.toList());
    }
}
