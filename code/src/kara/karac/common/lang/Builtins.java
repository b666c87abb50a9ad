/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package kara.karac.common.lang;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import kara.karac.common.Logging;
import kara.karac.common.exceptions.InvalidOptionException;
import kara.karac.common.exceptions.KaracRuntimeError;
import kara.karac.common.lang.Types.FunctionType;
import kara.karac.common.lang.Types.Type;

/**
 * Table of built-in functions supplied by the standard library.
 * All of them are impure leaves for the purity analysis: the front end
 * never sees their bodies.
 *
 * Table format, one function per line, '#' starts a comment:
 * <pre>
 *   Print(message: string) -> ()
 *   Now() -> i64
 * </pre>
 */
public class Builtins {

  /** Classpath location of the default table */
  public static final String DEFAULT_TABLE = "kara/karac/builtins.txt";

  private static final Pattern ENTRY = Pattern.compile(
      "\\s*([\\p{L}_][\\p{L}\\p{N}_]*)\\s*\\((.*)\\)\\s*->\\s*(.+?)\\s*");

  private static final Pattern PARAM = Pattern.compile(
      "\\s*([\\p{L}_][\\p{L}\\p{N}_]*)\\s*:\\s*(.+?)\\s*");

  public static class BuiltinFunction {
    private final String name;
    private final FunctionType type;

    public BuiltinFunction(String name, FunctionType type) {
      this.name = name;
      this.type = type;
    }

    public String getName() {
      return name;
    }

    public FunctionType getType() {
      return type;
    }

    public Purity getPurity() {
      return Purity.IMPURE;
    }

    @Override
    public String toString() {
      return name + type;
    }
  }

  private final Map<String, BuiltinFunction> functions;

  private Builtins(Map<String, BuiltinFunction> functions) {
    this.functions = Collections.unmodifiableMap(
                  new LinkedHashMap<String, BuiltinFunction>(functions));
  }

  public static Builtins empty() {
    return new Builtins(Collections.<String, BuiltinFunction>emptyMap());
  }

  /**
   * Is this the name of a builtin?
   */
  public boolean exists(String name) {
    return functions.containsKey(name);
  }

  /**
   * @return the builtin, or null if no such builtin
   */
  public BuiltinFunction lookup(String name) {
    return functions.get(name);
  }

  public Collection<BuiltinFunction> getAll() {
    return functions.values();
  }

  public int size() {
    return functions.size();
  }

  /**
   * Load the table shipped on the classpath
   */
  public static Builtins loadDefault() {
    InputStream in = Builtins.class.getClassLoader()
                                   .getResourceAsStream(DEFAULT_TABLE);
    if (in == null) {
      throw new KaracRuntimeError("Built-in table missing from classpath: "
                                  + DEFAULT_TABLE);
    }
    try {
      try {
        List<String> lines = IOUtils.readLines(in, StandardCharsets.UTF_8);
        return parse(DEFAULT_TABLE, lines);
      } finally {
        in.close();
      }
    } catch (IOException e) {
      throw new KaracRuntimeError("Could not read built-in table "
                                  + DEFAULT_TABLE, e);
    } catch (InvalidOptionException e) {
      throw new KaracRuntimeError("Invalid built-in table on classpath: "
                                  + e.getMessage(), e);
    }
  }

  /**
   * Load a table from a file
   * @throws IOException if file can't be read
   * @throws InvalidOptionException if file contents are malformed
   */
  public static Builtins load(File file)
      throws IOException, InvalidOptionException {
    List<String> lines = FileUtils.readLines(file, StandardCharsets.UTF_8);
    return parse(file.getPath(), lines);
  }

  public static Builtins parse(String source, List<String> lines)
      throws InvalidOptionException {
    Logger logger = Logging.getKaracLogger();
    Map<String, BuiltinFunction> result =
                  new LinkedHashMap<String, BuiltinFunction>();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      int comment = line.indexOf('#');
      if (comment >= 0) {
        line = line.substring(0, comment);
      }
      if (line.trim().isEmpty()) {
        continue;
      }
      String where = source + ":" + (i + 1);
      BuiltinFunction fn = parseEntry(where, line);
      if (result.containsKey(fn.getName())) {
        throw new InvalidOptionException(where + ": built-in " +
                          fn.getName() + " defined twice");
      }
      result.put(fn.getName(), fn);
      if (logger.isTraceEnabled()) {
        logger.trace("builtin: " + fn);
      }
    }
    logger.debug("Loaded " + result.size() + " built-ins from " + source);
    return new Builtins(result);
  }

  private static BuiltinFunction parseEntry(String where, String line)
      throws InvalidOptionException {
    Matcher m = ENTRY.matcher(line);
    if (!m.matches()) {
      throw new InvalidOptionException(where + ": expected " +
                     "Name(param: type, ...) -> type but got: " + line);
    }
    String name = m.group(1);
    List<String> paramNames = new ArrayList<String>();
    List<Type> paramTypes = new ArrayList<Type>();
    String params = m.group(2).trim();
    if (!params.isEmpty()) {
      for (String param: params.split(",")) {
        Matcher pm = PARAM.matcher(param);
        if (!pm.matches()) {
          throw new InvalidOptionException(where + ": malformed parameter '"
                                           + param.trim() + "'");
        }
        paramNames.add(pm.group(1));
        paramTypes.add(parseType(where, pm.group(2)));
      }
    }
    Type result = parseType(where, m.group(3));
    return new BuiltinFunction(name,
                    new FunctionType(paramNames, paramTypes, result));
  }

  /**
   * Built-ins only deal in primitives and unit
   */
  private static Type parseType(String where, String typeName)
      throws InvalidOptionException {
    String trimmed = typeName.trim();
    if (trimmed.replace(" ", "").equals("()")) {
      return Types.UNIT;
    }
    Type t = Types.lookupPrimitive(trimmed);
    if (t == null) {
      throw new InvalidOptionException(where + ": unknown built-in type "
                                       + trimmed);
    }
    return t;
  }
}
