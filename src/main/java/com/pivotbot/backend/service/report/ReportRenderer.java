package com.pivotbot.backend.service.report;

import com.pivotbot.backend.model.CycleReport;

/**
 * Receives the outcome of every cycle. Rendering failures must not affect trading.
 */
public interface ReportRenderer {

    void render(CycleReport report);
}
