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
package kara.karac.ast;

/**
 * Simple immutable class to record a position in a source file.
 * Lines and columns are 1-based, columns count bytes from the
 * start of the line.  Offset is the 0-based byte offset in the file.
 */
public class FilePosition implements Comparable<FilePosition> {
  public final String file;
  public final int line;
  public final int col;
  public final int offset;

  public FilePosition(String file, int line, int col, int offset) {
    super();
    this.file = file;
    this.line = line;
    this.col = col;
    this.offset = offset;
  }

  /**
   * Position for things that don't come from source, e.g. built-ins
   */
  public static FilePosition unknown(String file) {
    return new FilePosition(file, 0, 0, -1);
  }

  public boolean isKnown() {
    return offset >= 0;
  }

  @Override
  public int compareTo(FilePosition o) {
    if (offset != o.offset) {
      return offset < o.offset ? -1 : 1;
    } else if (line != o.line) {
      return line < o.line ? -1 : 1;
    } else if (col != o.col) {
      return col < o.col ? -1 : 1;
    }
    return 0;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + offset;
    result = prime * result + line;
    result = prime * result + col;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof FilePosition))
      return false;
    FilePosition other = (FilePosition) obj;
    if (file == null ? other.file != null : !file.equals(other.file))
      return false;
    return offset == other.offset && line == other.line && col == other.col;
  }

  public String toString() {
    if (col > 0) {
      return file + ":" + line + ":" + col;
    }
    return file + ":" + line;
  }
}
