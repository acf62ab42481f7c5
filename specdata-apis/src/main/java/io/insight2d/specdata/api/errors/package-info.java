/// Typed failures for spectrum decoding, encoding and introspection.
///
/// Every failure extends [io.insight2d.specdata.api.errors.SpectrumDataException], which is
/// unchecked and carries the path, format and cause involved.
package io.insight2d.specdata.api.errors;
