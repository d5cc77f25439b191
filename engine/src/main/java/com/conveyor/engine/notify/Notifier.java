package com.conveyor.engine.notify;

import com.conveyor.engine.model.PipelineRun;

/**
 * Sends the report of a finalized run. The executor calls this once per run.
 */
public interface Notifier {

    void notify(PipelineRun run, NotificationChannel channel, ReportTemplate template);
}
