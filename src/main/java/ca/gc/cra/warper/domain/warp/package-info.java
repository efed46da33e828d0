/**
 * Work items, tool options, command outcomes, and loop outcomes exchanged by the reprojection pipeline.
 *
 * @since WARPER 0.1
 */
package ca.gc.cra.warper.domain.warp;
