/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.insight2d.specdata.api.services;

import io.insight2d.specdata.api.fileio.SpectrumDecoder;
import io.insight2d.specdata.api.fileio.SpectrumEncoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// An immutable mapping from each [SpectrumFormat] to its decoder and encoder.
///
/// Codecs declare their format with the [Format] annotation. The registry is fully built by its
/// constructor and never changes afterwards, so it can be shared between threads. Adding a
/// format means adding a [SpectrumFormat] constant and one annotated codec.
public class SpectrumCodecRegistry {
  private static final Logger logger = LogManager.getLogger(SpectrumCodecRegistry.class);

  private final Map<SpectrumFormat, SpectrumDecoder> decoders;
  private final Map<SpectrumFormat, SpectrumEncoder> encoders;

  /// Build a registry from codec instances. Each instance may implement [SpectrumDecoder],
  /// [SpectrumEncoder] or both, and must carry a [Format] annotation.
  /// @param codecs
  ///     the codec instances
  /// @throws IllegalArgumentException
  ///     if a codec lacks the annotation, implements neither interface, or two codecs claim the
  ///     same format and direction
  public SpectrumCodecRegistry(Collection<?> codecs) {
    Map<SpectrumFormat, SpectrumDecoder> decoderMap = new EnumMap<>(SpectrumFormat.class);
    Map<SpectrumFormat, SpectrumEncoder> encoderMap = new EnumMap<>(SpectrumFormat.class);
    for (Object codec : codecs) {
      SpectrumFormat format = formatOf(codec.getClass()).orElseThrow(
          () -> new IllegalArgumentException(
              "codec " + codec.getClass().getCanonicalName() + " has no @Format annotation"));
      boolean registered = false;
      if (codec instanceof SpectrumDecoder decoder) {
        register(decoderMap, format, decoder, "decoder");
        registered = true;
      }
      if (codec instanceof SpectrumEncoder encoder) {
        register(encoderMap, format, encoder, "encoder");
        registered = true;
      }
      if (!registered) {
        throw new IllegalArgumentException(
            codec.getClass().getCanonicalName() + " is neither a SpectrumDecoder nor a "
            + "SpectrumEncoder");
      }
    }
    this.decoders = Collections.unmodifiableMap(decoderMap);
    this.encoders = Collections.unmodifiableMap(encoderMap);
  }

  /// Build a registry from every decoder and encoder visible to [ServiceLoader].
  /// Providers without a [Format] annotation are skipped with a warning.
  /// @return the registry
  public static SpectrumCodecRegistry load() {
    List<Object> codecs = Stream.concat(
            annotatedProviders(ServiceLoader.load(SpectrumDecoder.class)),
            annotatedProviders(ServiceLoader.load(SpectrumEncoder.class)))
        .collect(Collectors.toList());
    SpectrumCodecRegistry registry = new SpectrumCodecRegistry(codecs);
    logger.debug("loaded spectrum codecs: decoders={} encoders={}",
        registry.decoders.keySet(), registry.encoders.keySet());
    return registry;
  }

  private static <T> Stream<Object> annotatedProviders(ServiceLoader<T> loader) {
    return loader.stream()
        .filter(provider -> {
          if (formatOf(provider.type()).isEmpty()) {
            logger.warn("ignoring codec {} which has no @Format annotation",
                provider.type().getCanonicalName());
            return false;
          }
          return true;
        })
        .map(ServiceLoader.Provider::get);
  }

  private static Optional<SpectrumFormat> formatOf(Class<?> type) {
    return Optional.ofNullable(type.getAnnotation(Format.class)).map(Format::value);
  }

  private static <T> void register(
      Map<SpectrumFormat, T> map,
      SpectrumFormat format,
      T codec,
      String role
  )
  {
    T existing = map.get(format);
    if (existing != null && existing.getClass() != codec.getClass()) {
      throw new IllegalArgumentException(
          "two " + role + "s registered for " + format + ": "
          + existing.getClass().getCanonicalName() + " and " + codec.getClass().getCanonicalName());
    }
    if (existing == null) {
      map.put(format, codec);
    }
  }

  /// @param format
  ///     a format
  /// @return the decoder registered for the format, if any
  public Optional<SpectrumDecoder> decoderFor(SpectrumFormat format) {
    return Optional.ofNullable(decoders.get(format));
  }

  /// @param format
  ///     a format
  /// @return the encoder registered for the format, if any
  public Optional<SpectrumEncoder> encoderFor(SpectrumFormat format) {
    return Optional.ofNullable(encoders.get(format));
  }

  /// @return the formats which can be decoded
  public Set<SpectrumFormat> decodableFormats() {
    return decoders.keySet();
  }

  /// @return the formats which can be encoded
  public Set<SpectrumFormat> encodableFormats() {
    return encoders.keySet();
  }
}
