/**
 * Compiled scenario model and the graph compiler.
 *
 * <ul>
 *   <li>{@link com.crossbot.scenario.tree} – compiled nodes, response blocks, reply branches, symbolic references</li>
 *   <li>{@link com.crossbot.scenario.action} – action configuration variants (link, hand-off, form, jump, mail, csv)</li>
 *   <li>{@link com.crossbot.scenario.compile} – {@link com.crossbot.scenario.compile.NodeClassifier},
 *       {@link com.crossbot.scenario.compile.TreeBuilder}, {@link com.crossbot.scenario.compile.SymbolResolver}
 *       and the {@link com.crossbot.scenario.compile.ScenarioCompiler} facade</li>
 *   <li>{@link com.crossbot.scenario.store} – {@link com.crossbot.scenario.store.ScenarioStore} and the in-memory store</li>
 *   <li>{@link com.crossbot.scenario.ScenarioJson} – {@code toJson}/{@code fromJson} for definitions and trees</li>
 * </ul>
 */
package com.crossbot.scenario;
