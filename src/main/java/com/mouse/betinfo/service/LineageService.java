package com.mouse.betinfo.service;

import com.mouse.betinfo.entity.Analysis;
import com.mouse.betinfo.exception.IntegrityException;
import com.mouse.betinfo.model.LineageView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read side of the analysis DAG. Structure is fixed at insert time (a parent must
 * already be stored), so everything here is traversal.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LineageService {

    private final ImmutableStore store;

    public LineageView describe(String analysisId) {
        List<Analysis> path = store.listLineagePath(analysisId);
        Analysis target = path.get(path.size() - 1);
        return new LineageView(target, path, store.listChildren(analysisId));
    }

    /**
     * Every analysis below {@code analysisId}, breadth first.
     */
    public List<Analysis> descendants(String analysisId) {
        List<Analysis> found = new ArrayList<>();
        Set<String> seen = new HashSet<>(List.of(analysisId));
        List<String> frontier = new ArrayList<>(List.of(analysisId));
        while (!frontier.isEmpty()) {
            List<String> next = new ArrayList<>();
            for (String id : frontier) {
                for (Analysis child : store.listChildren(id)) {
                    if (!seen.add(child.getAnalysisId())) {
                        throw new IntegrityException("Analysis " + child.getAnalysisId() + " reached twice below " + analysisId);
                    }
                    found.add(child);
                    next.add(child.getAnalysisId());
                }
            }
            frontier = next;
        }
        return found;
    }

    public List<Analysis> roots() {
        return store.listRoots();
    }
}
