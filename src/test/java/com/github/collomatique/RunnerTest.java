package com.github.collomatique;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.TestFactory;

public class RunnerTest {

    @TestFactory
    public DynamicNode testFactory() {
        String basePathString = "src/test/resources/runner-tests";
        Path basePath = Paths.get(basePathString);

        var testFiles = basePath.toFile().listFiles((dir, name) -> name.endsWith(".colloml"));
        var tests = Arrays.stream(testFiles)
            .sorted(Comparator.comparing(File::getName))
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Runner tests", tests);
    }

    private DynamicNode createTest(File testFile) {
        var testName = testFile.getName().substring(0, testFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("run " + testName, () -> {
            var baos = new ByteArrayOutputStream();

            var runner = new Runner(new PrintStream(baos, true, StandardCharsets.UTF_8));
            runner.setLookupPath(List.of(testFile.getParent()));
            runner.runFile(testFile.getName());

            String expectedOutput;
            try (var s = Files.lines(testFile.toPath())) {
                expectedOutput = s.dropWhile(l -> !l.equals("# EXPECTED-OUTPUT")).skip(1)
                    .map(l -> l.substring(1).trim()).reduce("", (a, b) -> a + b + "\n");
            }

            assertEquals(expectedOutput, baos.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n"));
        });
    }

}
