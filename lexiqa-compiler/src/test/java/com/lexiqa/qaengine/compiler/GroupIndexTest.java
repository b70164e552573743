package com.lexiqa.qaengine.compiler;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class GroupIndexTest {

    @Test
    void shouldNumberNamedGroupsInOpeningOrder() {
        GroupIndex index = GroupIndex.of(Pattern.compile("(x)(?<first>a)(?:b)(?=c)(?<second>d(e))"));

        assertThat(index.groupCount()).isEqualTo(4);
        assertThat(index.numberOf("first")).hasValue(2);
        assertThat(index.numberOf("second")).hasValue(3);
        assertThat(index.numberOf("missing")).isEmpty();
    }

    @Test
    void shouldIgnoreParenthesesInClassesQuotesAndEscapes() {
        GroupIndex index = GroupIndex.of(Pattern.compile("[(\\]]\\(\\Q(\\E(?<name>z)(?<!q)"));

        assertThat(index.groupCount()).isEqualTo(1);
        assertThat(index.numberOf("name")).hasValue(1);
    }
}
