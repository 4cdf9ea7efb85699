/**
 * Document decoding and the embedded token grammars.
 * <p>
 * Contains the JSON/YAML reader, the path-aware {@code DataModelNode} view of the decoded tree,
 * and the small tokenizers for orientation-suffixed molecules and bracketed object expressions.
 * These are internal types.
 */
@org.springframework.lang.NonNullApi
package org.javai.cellsim.datamodel.internal.parse;
