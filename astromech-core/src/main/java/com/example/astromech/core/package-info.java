/**
 * Root package of the astromech library: AWS service helpers for Lambda functions.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.astromech.core.Astromech}: entry point owning the client cache and the
 *       service helpers.
 *   <li>{@link com.example.astromech.core.client.ClientCache}: lazily created, container-reused
 *       client handles with endpoint overrides for LocalStack.
 *   <li>{@link com.example.astromech.core.config.Environment}: settings lookup from system
 *       properties and environment variables.
 *   <li>{@link com.example.astromech.core.dynamodb.DynamoDbHelper}: table handle and key existence
 *       check.
 *   <li>{@link com.example.astromech.core.s3.S3Helper}: URI and default path helpers, object
 *       reads, writes and tags.
 *   <li>{@link com.example.astromech.core.sns.SnsHelper}: publishing with sender attributes.
 *   <li>{@link com.example.astromech.core.sqs.SqsHelper}: SQS event body decoding.
 *   <li>{@link com.example.astromech.core.ssm.SsmHelper}: Parameter Store reads.
 *   <li>{@link com.example.astromech.core.logging.LogLevels}: {@code LOG_LEVEL} handling.
 * </ul>
 */
package com.example.astromech.core;
