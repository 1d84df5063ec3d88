package io.github.augsuggest.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PathSegmenterTest extends AugSuggestTestBase {

    private static PathSegmenter segmenter(GroupIndex index, SuggestOptions options) {
        return new PathSegmenter(index, options);
    }

    @Test
    void splitsLabelMarkersIntoHeadsPositionsAndTails() {
        final var options = SuggestOptions.defaults();
        final var index = new GroupIndex(options);

        final var segments = segmenter(index, options).split(Leaf.of("/a/label[2]/b/label[3]/c", "v"));

        assertThat(segments).extracting(PathSegment::head)
                .containsExactly("/a/label", "/a/label[2]/b/label", "/a/label[2]/b/label[3]/c");
        assertThat(segments).extracting(PathSegment::segment)
                .containsExactly("/a/label", "/b/label", "/c");
        assertThat(segments).extracting(PathSegment::position)
                .containsExactly(2, 3, PathSegment.NO_POSITION);
        assertThat(segments).extracting(PathSegment::simplifiedTail)
                .containsExactly("/b/label/c", "/c", "");
        assertThat(segments).extracting(PathSegment::groupIndex)
                .containsExactly(0, 1, PathSegment.NO_GROUP);
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void numericMarkersKeepTheirSlashInTheHead() {
        final var options = SuggestOptions.defaults();
        final var index = new GroupIndex(options);

        final var segments = segmenter(index, options).split(Leaf.of("/files/etc/hosts/1/ipaddr", "127.0.0.1"));

        assertThat(segments).hasSize(2);
        final var first = segments.get(0);
        assertThat(first.head()).isEqualTo("/files/etc/hosts/");
        assertThat(first.position()).isEqualTo(1);
        assertThat(first.numericMarker()).isTrue();
        assertThat(first.simplifiedTail()).isEqualTo("/ipaddr");
        assertThat(segments.get(1).segment()).isEqualTo("/ipaddr");
        assertThat(segments.get(1).hasPosition()).isFalse();
    }

    @Test
    void numericMarkerAtEndOfPathHasEmptyTail() {
        final var options = SuggestOptions.defaults();
        final var segments = segmenter(new GroupIndex(options), options).split(Leaf.of("/files/etc/hosts/12"));

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).head()).isEqualTo("/files/etc/hosts/");
        assertThat(segments.get(0).position()).isEqualTo(12);
        assertThat(segments.get(0).simplifiedTail()).isEmpty();
    }

    @Test
    void simplifiedTailsUseTheConfiguredWildcard() {
        final var seq = SuggestOptions.defaults();
        final var plain = seq.withWildcard(WildcardStyle.PLAIN);

        final var withSeq = segmenter(new GroupIndex(seq), seq).split(Leaf.of("/a/1/b/2/c[4]/d"));
        final var withPlain = segmenter(new GroupIndex(plain), plain).split(Leaf.of("/a/1/b/2/c[4]/d"));

        assertThat(withSeq.get(0).simplifiedTail()).isEqualTo("/b/seq::*/c/d");
        assertThat(withPlain.get(0).simplifiedTail()).isEqualTo("/b/*/c/d");
        assertThat(withPlain).extracting(PathSegment::segment).containsExactly("/a/", "/b/", "/c", "/d");
    }

    @ParameterizedTest
    @ValueSource(strings = {"/a/label[12a]/b", "/a/label[0]/b", "/a/label[]/b", "/a/0/b", "/a/12x/b", "/a/label[99999999999]/b"})
    void malformedMarkersArePlainText(String path) {
        final var options = SuggestOptions.defaults();
        final var index = new GroupIndex(options);

        final var segments = segmenter(index, options).split(Leaf.of(path, "v"));

        assertThat(segments).hasSize(1);
        assertThat(segments.get(0).segment()).isEqualTo(path);
        assertThat(segments.get(0).hasPosition()).isFalse();
        assertThat(index.size()).isZero();
    }

    @Test
    void malformedMarkerInTailIsKeptVerbatim() {
        final var options = SuggestOptions.defaults();
        final var segments = segmenter(new GroupIndex(options), options).split(Leaf.of("/a/e[1]/x[0]/y[z]"));

        assertThat(segments.get(0).simplifiedTail()).isEqualTo("/x[0]/y[z]");
    }

    @Test
    void pathWithoutMarkersIsOneSegment() {
        final var options = SuggestOptions.defaults();
        final var segments = segmenter(new GroupIndex(options), options).split(Leaf.of("/files/etc/fstab"));

        assertThat(segments).singleElement()
                .satisfies(s -> {
                    assertThat(s.head()).isEqualTo("/files/etc/fstab");
                    assertThat(s.groupIndex()).isEqualTo(PathSegment.NO_GROUP);
                });
    }

    @Test
    void segmentsConcatenateBackToThePath() {
        final var options = SuggestOptions.defaults();
        final var path = "/files/etc/hosts/3/alias[2]/x/7";
        final var segments = segmenter(new GroupIndex(options), options).split(Leaf.of(path));

        final var rebuilt = new StringBuilder();
        for (final var segment : segments) {
            rebuilt.append(segment.segment());
            if (segment.hasPosition()) {
                rebuilt.append(segment.numericMarker() ? String.valueOf(segment.position()) : "[" + segment.position() + "]");
            }
        }
        assertThat(rebuilt.toString()).isEqualTo(path);
    }

    @Test
    void sameHeadResolvesToSameGroup() {
        final var options = SuggestOptions.defaults();
        final var index = new GroupIndex(options);
        final var segmenter = segmenter(index, options);

        final var first = segmenter.split(Leaf.of("/h/e[1]/k", "x"));
        final var second = segmenter.split(Leaf.of("/h/e[2]/k", "y"));

        assertThat(first.get(0).groupIndex()).isEqualTo(second.get(0).groupIndex());
        assertThat(index.group(0).maxPosition()).isEqualTo(2);
    }

    @Test
    void childPathRequiresSlashAfterParent() {
        assertThat(PathSegmenter.isChildPath("/a/b", "/a/b/c")).isTrue();
        assertThat(PathSegmenter.isChildPath("/a/b", "/a/bc")).isFalse();
        assertThat(PathSegmenter.isChildPath("/a/b", "/a/b")).isFalse();
        assertThat(PathSegmenter.isChildPath("", "/k")).isTrue();
        assertThat(PathSegmenter.isChildPath("/k", "")).isFalse();
    }
}
