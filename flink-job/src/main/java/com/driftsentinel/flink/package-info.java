/**
 * Apache Flink streaming job for Drift Sentinel.
 *
 * <p>
 * This package wires the core drift detector into a Flink pipeline that
 * consumes fixed-length telemetry windows from Kafka, runs one layered
 * detector per stream key, and publishes drift alerts back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.driftsentinel.flink.DriftSentinelJob}: main entry point</li>
 * <li>{@link com.driftsentinel.flink.DriftProcessFunction}: keyed process
 * function</li>
 * <li>{@link com.driftsentinel.flink.JobConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.driftsentinel.flink.BaselineLoader}: baseline document
 * reader</li>
 * <li>{@link com.driftsentinel.flink.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.driftsentinel.flink;
