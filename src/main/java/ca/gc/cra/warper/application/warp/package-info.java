/**
 * Dispatch core of the warper service.
 * <p>The {@link ca.gc.cra.warper.application.warp.EventLoop} runs on one control thread, submits
 * {@link ca.gc.cra.warper.application.warp.ReprojectionStep} work to the
 * {@link ca.gc.cra.warper.application.warp.WorkDispatcher} pool and collects finished results through
 * {@link ca.gc.cra.warper.application.warp.ResultDrain}. Tool failures are values, never exceptions, so a
 * broken input never stops the loop.</p>
 *
 * @since WARPER 0.1
 */
package ca.gc.cra.warper.application.warp;
