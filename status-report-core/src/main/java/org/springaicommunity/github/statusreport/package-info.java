/**
 * GitHub status report core package.
 *
 * <p>
 * Contains the weekly windowing and section classification engine together with the
 * collaborators that feed it (GitHub project access, configuration) and consume it
 * (markdown rendering, report files, archiving).
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.statusreport;

import org.jspecify.annotations.NullMarked;
