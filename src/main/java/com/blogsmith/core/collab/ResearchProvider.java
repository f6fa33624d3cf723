package com.blogsmith.core.collab;

import com.blogsmith.core.model.ResearchSummary;

/**
 * Gathers and synthesizes source material for a topic. Called once per run.
 */
public interface ResearchProvider {

    ResearchSummary research(String topic);
}
