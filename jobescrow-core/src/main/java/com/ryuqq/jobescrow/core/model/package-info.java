/**
 * Core value objects.
 *
 * <ul>
 *   <li>{@link com.ryuqq.jobescrow.core.model.AccountAddress} - caller identity or derived record address</li>
 *   <li>{@link com.ryuqq.jobescrow.core.model.UserRole} - CLIENT / FREELANCER</li>
 *   <li>{@link com.ryuqq.jobescrow.core.model.FieldLimit} - storage size limits checked at write time</li>
 *   <li>{@link com.ryuqq.jobescrow.core.model.JobSchedule} - optional job start/end dates</li>
 *   <li>{@link com.ryuqq.jobescrow.core.model.Amounts} - unsigned 64-bit amount arithmetic</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author JobEscrow Team
 */
package com.ryuqq.jobescrow.core.model;
