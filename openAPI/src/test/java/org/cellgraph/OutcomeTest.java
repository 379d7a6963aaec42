/*
 * Copyright 2010 - 2023 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.cellgraph;

import org.junit.Assert;
import org.junit.Test;

public class OutcomeTest {

    @Test
    public void okCarriesValue() {
        final Outcome<String> outcome = Outcome.ok("value");
        Assert.assertTrue(outcome.isOk());
        Assert.assertEquals(Outcome.State.OK, outcome.getState());
        Assert.assertEquals("value", outcome.get());
        Assert.assertNull(outcome.getErrorKind());
    }

    @Test
    public void okNullIsDone() {
        Assert.assertSame(Outcome.done(), Outcome.ok(null));
        Assert.assertNull(Outcome.done().get());
    }

    @Test
    public void fatalCarriesError() {
        final Outcome<String> outcome = Outcome.fatal(ErrorKind.CONNECTION_LOST, "lost");
        Assert.assertTrue(outcome.isFatal());
        Assert.assertEquals(ErrorKind.CONNECTION_LOST, outcome.getErrorKind());
        Assert.assertEquals(ErrorCategory.TRANSPORT, outcome.getError().getCategory());
        Assert.assertEquals("lost", outcome.getError().getMessage());
        TestUtil.runWithExpectedException(outcome::get, IllegalStateException.class);
    }

    @Test
    public void retryHasNoError() {
        final Outcome<Integer> outcome = Outcome.retry();
        Assert.assertTrue(outcome.isRetry());
        Assert.assertNull(outcome.getErrorKind());
        TestUtil.runWithExpectedException(outcome::getError, IllegalStateException.class);
        TestUtil.runWithExpectedException(outcome::get, IllegalStateException.class);
    }

    @Test
    public void combinatorsApplyToOkOnly() {
        Assert.assertEquals(Integer.valueOf(6), Outcome.ok("abc").map(String::length).map(l -> l * 2).get());
        Assert.assertEquals("3", Outcome.ok(3).then(i -> Outcome.ok(String.valueOf(i))).get());
        Assert.assertTrue(Outcome.<String>retry().map(String::length).isRetry());
        final Outcome<Integer> fatal = Outcome.<String>fatal(ErrorKind.LIST_CORRUPTED, "broken").then(s -> Outcome.ok(s.length()));
        Assert.assertEquals(ErrorKind.LIST_CORRUPTED, fatal.getErrorKind());
        Assert.assertEquals(ErrorCategory.LIST, fatal.getError().getCategory());
    }

    @Test
    public void okCannotBeCast() {
        TestUtil.runWithExpectedException(() -> Outcome.ok(1).cast(), IllegalStateException.class);
    }

    @Test
    public void everyKindHasCategory() {
        for (final ErrorKind kind : ErrorKind.values()) {
            Assert.assertNotNull(kind.getCategory());
        }
        Assert.assertEquals(ErrorCategory.VALIDATION, ErrorKind.BODY_REQUIRED.getCategory());
        Assert.assertEquals(ErrorCategory.STORAGE, ErrorKind.STORAGE_FAILURE.getCategory());
        Assert.assertEquals(ErrorCategory.TRANSPORT, ErrorKind.NOT_SENT.getCategory());
        Assert.assertEquals(ErrorCategory.LIST, ErrorKind.LIST_MEMBER_NOT_FOUND.getCategory());
    }
}
