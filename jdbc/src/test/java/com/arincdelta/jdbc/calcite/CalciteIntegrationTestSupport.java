package com.arincdelta.jdbc.calcite;

import com.arincdelta.jdbc.testing.TestResources;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Small helper for Calcite integration tests so every test builds the same connection properties
 * and resolves snapshot files in the same way.
 */
final class CalciteIntegrationTestSupport {

    private CalciteIntegrationTestSupport() {}

    static Properties newCalciteConnectionProperties(String extraOperands) {
        Properties props = new Properties();
        props.setProperty(
                "model",
                inlineModel(TestResources.snapshot("old.pc"), TestResources.snapshot("new.pc"), extraOperands));
        props.setProperty("lex", "JAVA");
        props.setProperty("quoting", "DOUBLE_QUOTE");
        props.setProperty("caseSensitive", "true");
        return props;
    }

    private static String inlineModel(Path oldPath, Path newPath, String extraOperands) {
        return """
                inline:{
                  "version":"1.0",
                  "defaultSchema":"delta",
                  "schemas":[
                    {
                      "type":"custom",
                      "name":"delta",
                      "factory":"com.arincdelta.jdbc.calcite.DeltaSchemaFactory",
                      "operand":{"old":"%s","new":"%s"%s}
                    }
                  ]
                }
                """
                .formatted(
                        TestResources.calciteOperand(oldPath),
                        TestResources.calciteOperand(newPath),
                        extraOperands.isEmpty() ? "" : "," + extraOperands);
    }
}
