/**
 * Authoring formats that convert to and from the compiled tree.
 *
 * <ul>
 *   <li>{@link com.crossbot.codec.editor} – visual editor document (nodes, connections, rich-text responses)</li>
 *   <li>{@link com.crossbot.codec.tabular} – spreadsheet rows, one root-to-leaf path per row</li>
 * </ul>
 */
package com.crossbot.codec;
