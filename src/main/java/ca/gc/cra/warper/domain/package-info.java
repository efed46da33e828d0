/**
 * Core domain model for the WARPER subscribe → reproject → publish loop.
 * <p><strong>Role:</strong> Domain layer values describing work items, tool invocations, and outcomes without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to hand off between the control thread and workers.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code warper.*} metrics.</p>
 */
package ca.gc.cra.warper.domain;
