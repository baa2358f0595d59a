/*
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
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
 *
 *
 */

package org.overf.printer;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.printer.DefaultPrettyPrinter;
import com.github.javaparser.printer.configuration.DefaultConfigurationOption;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration.ConfigOption;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes rewritten nodes back to Java source.
 */
public class BlockPrinter {

    private final DefaultPrettyPrinter printer;
    private final DefaultPrettyPrinter codeOnlyPrinter;

    public BlockPrinter() {
        this.printer = new DefaultPrettyPrinter(new DefaultPrinterConfiguration());
        this.codeOnlyPrinter = new DefaultPrettyPrinter(
                new DefaultPrinterConfiguration().removeOption(new DefaultConfigurationOption(ConfigOption.PRINT_COMMENTS)));
    }

    public String print(Node node) {
        return printer.print(node);
    }

    /**
     * Prints statements one after another without enclosing braces, so declarations stay
     * visible to whatever follows them in the caller's source.
     */
    public String printStatements(List<? extends Statement> statements) {
        return statements.stream()
                .map(printer::print)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Prints {@code node} on a single line without comments, for messages.
     */
    public String printInline(Node node) {
        return codeOnlyPrinter.print(node).replaceAll("\\s+", " ").trim();
    }
}
