/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.pipeline.staging;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a delimited text file with a header row. Files ending in
 * {@code .tsv} are tab-separated, everything else comma-separated.
 */
public class CsvRawSource implements RawSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvRawSource.class);

  private final Path file;

  public CsvRawSource(Path file) {
    this.file = file;
  }

  @Override public String getLocation() {
    return file.toAbsolutePath().toString();
  }

  public Path getFile() {
    return file;
  }

  @Override public RawRowReader open() throws IOException {
    Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
    CSVReader csvReader;
    if (file.getFileName().toString().endsWith(".tsv")) {
      csvReader = new CSVReaderBuilder(reader)
          .withCSVParser(new CSVParserBuilder().withSeparator('\t').build())
          .build();
    } else {
      csvReader = new CSVReader(reader);
    }
    try {
      String[] header = csvReader.readNext();
      if (header == null) {
        throw new IOException("Source " + getLocation() + " is empty (no header row)");
      }
      LOGGER.debug("Opened {} with {} header columns", getLocation(), header.length);
      return new CsvRowReader(csvReader, header);
    } catch (IOException | CsvValidationException | RuntimeException e) {
      csvReader.close();
      if (e instanceof IOException) {
        throw (IOException) e;
      }
      throw new IOException("Cannot read header of " + getLocation() + ": " + e.getMessage(), e);
    }
  }

  @Override public String fingerprint() throws IOException {
    return com.google.common.io.Files.asByteSource(file.toFile())
        .hash(Hashing.sha256())
        .toString();
  }

  @Override public String toString() {
    return "CsvRawSource{" + file + "}";
  }

  /**
   * Reader over an open {@link CSVReader}.
   */
  private static class CsvRowReader implements RawRowReader {
    private final CSVReader csvReader;
    private final List<String> header;
    private long rowIndex = 0;

    CsvRowReader(CSVReader csvReader, String[] header) {
      this.csvReader = csvReader;
      this.header = ImmutableList.copyOf(trimBom(header));
    }

    private static String[] trimBom(String[] header) {
      if (header.length > 0 && header[0].startsWith("\uFEFF")) {
        header[0] = header[0].substring(1);
      }
      return header;
    }

    @Override public List<String> getHeader() {
      return header;
    }

    @Override public @Nullable RawRecord next() throws IOException {
      String[] values;
      try {
        values = csvReader.readNext();
      } catch (CsvValidationException e) {
        rowIndex++;
        return RawRecord.unreadable(rowIndex, e.getMessage());
      }
      if (values == null) {
        return null;
      }
      rowIndex++;
      return RawRecord.of(rowIndex, values);
    }

    @Override public void close() throws IOException {
      csvReader.close();
    }
  }
}
