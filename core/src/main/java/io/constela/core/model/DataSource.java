package io.constela.core.model;

import java.util.Objects;

/**
 * Build-time data source. Resolved outside the compiler; the resolved values reach the evaluator
 * through the compiled program's {@code importData}.
 *
 * @param type      {@code glob}, {@code file} or {@code api}
 * @param pattern   glob pattern ({@code glob})
 * @param path      file path ({@code file})
 * @param url       endpoint ({@code api})
 * @param transform optional post-processing ({@code mdx}, {@code yaml}, {@code csv})
 */
public record DataSource(String type, String pattern, String path, String url, String transform) {

    public DataSource {
        Objects.requireNonNull(type, "type must not be null");
    }
}
