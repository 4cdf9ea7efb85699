/**
 * Internal implementation details of the data model importer.
 * <p>
 * <b>WARNING:</b> Types in this package and its sub-packages are not part of the public API and
 * may change without notice. Use {@link org.javai.cellsim.datamodel.DataModelImporter} instead.
 */
@org.springframework.lang.NonNullApi
package org.javai.cellsim.datamodel.internal;
