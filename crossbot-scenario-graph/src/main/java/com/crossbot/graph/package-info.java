/**
 * Flow-chart graph document ingestion.
 *
 * <ul>
 *   <li>{@link com.crossbot.graph.GraphIngestor} – parses {@code {"cells": [...]}} into
 *       {@link com.crossbot.graph.RawNodeCell} and {@link com.crossbot.graph.RawLinkCell}</li>
 *   <li>{@link com.crossbot.graph.LinkResolver} – source cell id → ordered target ids</li>
 *   <li>{@link com.crossbot.graph.state} – typed view of the free-form node state</li>
 * </ul>
 */
package com.crossbot.graph;
