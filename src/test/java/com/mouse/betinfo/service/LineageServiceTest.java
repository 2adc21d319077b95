package com.mouse.betinfo.service;

import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.exception.IntegrityException;
import com.mouse.betinfo.model.LineageView;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LineageServiceTest {

    @Mock
    ImmutableStore store;

    @InjectMocks
    LineageService lineageService;

    @Test
    void describe_returnsPathChildrenAndDepth() {
        Analysis root = analysis(null);
        Analysis middle = analysis(root.getAnalysisId());
        Analysis leaf = analysis(middle.getAnalysisId());
        when(store.listLineagePath(middle.getAnalysisId())).thenReturn(List.of(root, middle));
        when(store.listChildren(middle.getAnalysisId())).thenReturn(List.of(leaf));

        LineageView view = lineageService.describe(middle.getAnalysisId());

        assertThat(view.analysis()).isSameAs(middle);
        assertThat(view.path()).containsExactly(root, middle);
        assertThat(view.children()).containsExactly(leaf);
        assertThat(view.depth()).isEqualTo(1);
    }

    @Test
    void descendants_walksBreadthFirst() {
        Analysis root = analysis(null);
        Analysis a = analysis(root.getAnalysisId());
        Analysis b = analysis(root.getAnalysisId());
        Analysis a1 = analysis(a.getAnalysisId());
        when(store.listChildren(anyString())).thenReturn(List.of());
        when(store.listChildren(root.getAnalysisId())).thenReturn(List.of(a, b));
        when(store.listChildren(a.getAnalysisId())).thenReturn(List.of(a1));

        assertThat(lineageService.descendants(root.getAnalysisId())).containsExactly(a, b, a1);
    }

    @Test
    void descendants_sameAnalysisReachedTwice_throws() {
        Analysis root = analysis(null);
        Analysis a = analysis(root.getAnalysisId());
        when(store.listChildren(root.getAnalysisId())).thenReturn(List.of(a));
        when(store.listChildren(a.getAnalysisId())).thenReturn(List.of(a));

        assertThatThrownBy(() -> lineageService.descendants(root.getAnalysisId()))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("reached twice");
    }

    private static Analysis analysis(String parentId) {
        return Analysis.builder()
                .analysisVersion("1.0.0")
                .codeVersion("test")
                .parentAnalysisId(parentId)
                .inputSnapshotIds(List.of("snap-1"))
                .build();
    }
}
