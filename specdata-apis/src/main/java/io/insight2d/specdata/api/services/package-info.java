/// Format identification, codec registration and dispatch.
///
/// ## Key Components
///
/// - {@link io.insight2d.specdata.api.services.SpectrumFormat}: the closed set of file formats and their extensions
/// - {@link io.insight2d.specdata.api.services.Format}: annotation binding a codec to a format
/// - {@link io.insight2d.specdata.api.services.SpectrumCodecRegistry}: immutable format to codec mapping, loaded with ServiceLoader
/// - {@link io.insight2d.specdata.api.services.SpectrumFileIO}: decode and encode entry point
///
/// ## Usage Example
///
/// ```java
/// @AutoService(SpectrumDecoder.class)
/// @Format(SpectrumFormat.csv)
/// public class CsvSpectrumCodec implements SpectrumDecoder, SpectrumEncoder {
///     // implementation
/// }
/// ```
package io.insight2d.specdata.api.services;
