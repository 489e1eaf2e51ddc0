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
package feedconverter.conversion.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.SQSBatchResponse;
import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import com.amazonaws.services.lambda.runtime.events.SQSEvent.SQSMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import feedconverter.conversion.ConversionJobRunner;
import feedconverter.conversion.ConverterClients;
import feedconverter.core.job.ConversionJob;
import feedconverter.core.job.ConversionJobSerDe;
import feedconverter.core.job.ConversionJobValidationException;
import feedconverter.core.properties.ConverterProperties;
import feedconverter.core.source.MalformedKeyException;
import feedconverter.core.util.LoggedDuration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs conversion jobs received from an SQS queue. Each message holds one job. Messages that fail for reasons a
 * retry could fix are reported as batch item failures, so the queue delivers them again. Messages holding an invalid
 * job are logged and dropped.
 */
public class ConversionJobLambda implements RequestHandler<SQSEvent, SQSBatchResponse> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionJobLambda.class);

    private final ConversionJobSerDe serDe = new ConversionJobSerDe();
    private final ConversionJobRunner runner;

    public ConversionJobLambda() {
        this(ConverterProperties.fromEnvironment(System.getenv()), ConverterClients.createDefault());
    }

    public ConversionJobLambda(ConverterProperties properties, ConverterClients clients) {
        this(new ConversionJobRunner(properties, clients.getObjectStore()));
    }

    public ConversionJobLambda(ConversionJobRunner runner) {
        this.runner = runner;
    }

    @Override
    public SQSBatchResponse handleRequest(SQSEvent event, Context context) {
        Instant startTime = Instant.now();
        LOGGER.info("Lambda started at {} with {} messages", startTime, event.getRecords().size());
        List<SQSBatchResponse.BatchItemFailure> batchItemFailures = new ArrayList<>();
        for (SQSMessage message : event.getRecords()) {
            if (!handleMessage(message)) {
                batchItemFailures.add(new SQSBatchResponse.BatchItemFailure(message.getMessageId()));
            }
        }
        Instant finishTime = Instant.now();
        LOGGER.info("Lambda finished at {} (ran for {}), {} messages failed",
                finishTime, LoggedDuration.between(startTime, finishTime), batchItemFailures.size());
        return new SQSBatchResponse(batchItemFailures);
    }

    private boolean handleMessage(SQSMessage message) {
        ConversionJob job;
        try {
            job = serDe.fromJson(message.getBody());
        } catch (ConversionJobValidationException e) {
            LOGGER.error("Dropping message {} as it does not hold a valid job: {}", message.getMessageId(), message.getBody(), e);
            return true;
        }
        try {
            runner.run(job);
            return true;
        } catch (ConversionJobValidationException | MalformedKeyException e) {
            LOGGER.error("Dropping invalid job from message {}: {}", message.getMessageId(), job, e);
            return true;
        } catch (RuntimeException e) {
            LOGGER.error("Failed job from message {}: {}", message.getMessageId(), job, e);
            return false;
        }
    }
}
