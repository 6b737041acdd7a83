package com.bucketcopy.utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;

import static com.bucketcopy.utils.IsEmpty.isEmpty;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class TestIsEmpty {
    @Test
    public void testStrings() {
        assertThat(isEmpty((String)null), is(true));
        assertThat(isEmpty(""), is(true));
        assertThat(isEmpty(" "), is(false));
        assertThat(isEmpty("private"), is(false));
    }

    @Test
    public void testCollections() {
        assertThat(isEmpty((List<String>)null), is(true));
        assertThat(isEmpty(Collections.emptyList()), is(true));
        assertThat(isEmpty(Arrays.asList(1)), is(false));
        assertThat(isEmpty((Map<String, String>)null), is(true));
        assertThat(isEmpty(Collections.emptyMap()), is(true));
        assertThat(isEmpty(Collections.singletonMap("owner", "build-team")), is(false));
    }
}
