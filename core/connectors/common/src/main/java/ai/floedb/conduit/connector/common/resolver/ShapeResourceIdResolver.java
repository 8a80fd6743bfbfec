/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.conduit.connector.common.resolver;

import ai.floedb.conduit.connector.spi.InvalidResourceIdException;
import ai.floedb.conduit.connector.spi.ResourceId;
import ai.floedb.conduit.connector.spi.ResourceIdResolver;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolver built from an ordered list of shapes. The first shape whose pattern matches the whole
 * input decides the canonical id and the decomposed fields; input matching no shape is rejected.
 */
public final class ShapeResourceIdResolver implements ResourceIdResolver {

  public record Shape(String name, Pattern pattern, Function<Matcher, Parsed> decompose) {
    public Shape {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(pattern, "pattern");
      Objects.requireNonNull(decompose, "decompose");
    }
  }

  public record Parsed(String canonical, Map<String, String> fields) {
    public Parsed {
      Objects.requireNonNull(canonical, "canonical");
      fields = fields == null ? Map.of() : fields;
    }
  }

  private final String resourceType;
  private final List<Shape> shapes;
  private final String hint;

  private ShapeResourceIdResolver(String resourceType, List<Shape> shapes, String hint) {
    this.resourceType = resourceType;
    this.shapes = List.copyOf(shapes);
    this.hint = hint;
  }

  public static Builder builder(String resourceType) {
    return new Builder(resourceType);
  }

  @Override
  public String resourceType() {
    return resourceType;
  }

  public List<String> shapeNames() {
    return shapes.stream().map(Shape::name).toList();
  }

  @Override
  public ResourceId parse(String raw) {
    if (raw == null || raw.isEmpty()) {
      throw new InvalidResourceIdException(resourceType, String.valueOf(raw), hint);
    }
    for (Shape shape : shapes) {
      Matcher m = shape.pattern().matcher(raw);
      if (m.matches()) {
        Parsed parsed = shape.decompose().apply(m);
        return new ResourceId(resourceType, raw, parsed.canonical(), parsed.fields());
      }
    }
    throw new InvalidResourceIdException(resourceType, raw, hint);
  }

  public static final class Builder {
    private final String resourceType;
    private final List<Shape> shapes = new ArrayList<>();
    private String hint = "";

    private Builder(String resourceType) {
      this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
    }

    public Builder shape(String name, String regex, Function<Matcher, Parsed> decompose) {
      shapes.add(new Shape(name, Pattern.compile(regex), decompose));
      return this;
    }

    /** Text appended to rejection messages, usually the accepted formats. */
    public Builder hint(String hint) {
      this.hint = Objects.requireNonNullElse(hint, "");
      return this;
    }

    public ShapeResourceIdResolver build() {
      if (shapes.isEmpty()) {
        throw new IllegalStateException("resolver for " + resourceType + " has no shapes");
      }
      return new ShapeResourceIdResolver(resourceType, shapes, hint);
    }
  }
}
