package com.cymonides.grid.view;

import com.cymonides.grid.model.EdgeDirection;
import com.cymonides.grid.model.EmbeddedEdge;
import com.cymonides.grid.model.GridNode;
import com.cymonides.grid.model.NodeClass;
import com.cymonides.grid.model.NodePage;
import com.cymonides.grid.model.PageCursor;
import com.cymonides.grid.store.InMemoryNodeStoreTestDouble;
import com.cymonides.grid.store.NodeQuery;
import com.cymonides.grid.syntax.FilterClause;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class ViewComposerTest {

    private static final String PROJECT = "p1";

    private InMemoryNodeStoreTestDouble store;
    private ViewComposer composer;

    private static GridNode node(String id, String cls, String type, String updatedAt) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("updated_at", updatedAt);
        return GridNode.builder().id(id).label("Label " + id).nodeClass(cls).type(type).metadata(meta).build();
    }

    @BeforeEach
    public void setUp() {
        store = new InMemoryNodeStoreTestDouble();
        composer = new ViewComposer(store, 2000, 1000);
    }

    @Test
    public void classFilter_includesDeprecatedAliases() {
        NodeQuery q = composer.toQuery(ViewRequest.builder(PROJECT, NodeClass.LOCATION).build());
        assertEquals(Set.of("location", "source", "sources", "locations"), q.classNames());

        store.put(PROJECT, node("a", "source", "domain", "2024-01-01"));
        store.put(PROJECT, node("b", "location", "domain", "2024-01-02"));
        store.put(PROJECT, node("c", "subject", "person", "2024-01-03"));
        NodePage page = composer.compose(ViewRequest.builder(PROJECT, NodeClass.LOCATION).build());
        assertEquals(List.of("b", "a"), page.nodes().stream().map(GridNode::getId).toList());
        assertEquals(2, page.total());
    }

    @Test
    public void ordersByRecencyThenIdDescending() {
        store.put(PROJECT, node("a", "subject", "person", "2024-01-01"));
        store.put(PROJECT, node("b", "subject", "person", "2024-02-01"));
        store.put(PROJECT, node("c", "subject", "person", "2024-01-01"));
        NodePage page = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT).build());
        assertEquals(List.of("b", "c", "a"), page.nodes().stream().map(GridNode::getId).toList());
        assertNull(page.nextCursor(), "page not full, no continuation");
    }

    @Test
    public void fullPage_yieldsCursorThatResumes() {
        for (int i = 1; i <= 5; i++) {
            store.put(PROJECT, node("n" + i, "subject", "person", "2024-01-0" + i));
        }
        NodePage first = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT).limit(2).build());
        assertEquals(List.of("n5", "n4"), first.nodes().stream().map(GridNode::getId).toList());
        assertEquals(new PageCursor("2024-01-04", "n4"), first.nextCursor());

        NodePage second = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT)
                .limit(2).cursor(first.nextCursor()).build());
        assertEquals(List.of("n3", "n2"), second.nodes().stream().map(GridNode::getId).toList());
        assertEquals(5, second.total());
    }

    @Test
    public void paging_reachesNodesWithoutUpdatedAt() {
        store.put(PROJECT, node("n3", "subject", "person", "2024-01-03"));
        store.put(PROJECT, node("n2", "subject", "person", "2024-01-02"));
        store.put(PROJECT, node("n1", "subject", "person", null));
        store.put(PROJECT, node("n0", "subject", "person", null));

        NodePage first = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT).limit(2).build());
        assertEquals(List.of("n3", "n2"), first.nodes().stream().map(GridNode::getId).toList());

        NodePage second = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT)
                .limit(1).cursor(first.nextCursor()).build());
        assertEquals(List.of("n1"), second.nodes().stream().map(GridNode::getId).toList());
        assertEquals(new PageCursor("", "n1"), second.nextCursor());

        NodePage third = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT)
                .limit(1).cursor(second.nextCursor()).build());
        assertEquals(List.of("n0"), third.nodes().stream().map(GridNode::getId).toList());
        assertEquals(4, third.total());

        NodePage last = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT)
                .limit(1).cursor(third.nextCursor()).build());
        assertTrue(last.nodes().isEmpty());
    }

    @Test
    public void incompleteCursor_restartsFromTop() {
        NodeQuery q = composer.toQuery(ViewRequest.builder(PROJECT, NodeClass.SUBJECT)
                .cursor(new PageCursor("2024-01-04", null)).build());
        assertNull(q.cursor());
    }

    @Test
    public void limit_isCappedAndDefaulted() {
        assertEquals(2000, composer.toQuery(ViewRequest.builder(PROJECT, NodeClass.SUBJECT).limit(50_000).build()).size());
        assertEquals(1000, composer.toQuery(ViewRequest.builder(PROJECT, NodeClass.SUBJECT).build()).size());
    }

    @Test
    public void pins_matchNeighbourhoodTypeAndSelf() {
        GridNode neighbour = node("a", "subject", "person", "2024-01-01");
        neighbour.getEmbeddedEdges().add(EmbeddedEdge.builder().edgeId("e1").targetId("hub")
                .targetClass("subject").direction(EdgeDirection.OUTGOING).relationship("knows").build());
        store.put(PROJECT, neighbour);
        store.put(PROJECT, node("hub", "subject", "company", "2024-01-02"));
        store.put(PROJECT, node("other", "subject", "person", "2024-01-03"));
        store.put(PROJECT, node("typed", "subject", "vessel", "2024-01-04"));

        NodePage page = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT)
                .pins(List.of("hub", "type:vessel", PROJECT)).build());
        assertEquals(List.of("typed", "hub", "a"), page.nodes().stream().map(GridNode::getId).toList());

        NodeQuery q = store.getLastQuery();
        assertEquals(List.of("vessel"), q.typePins());
        assertEquals(List.of("hub"), q.nodePins(), "project id is never a pin");
    }

    @Test
    public void locationOnlyFilters_areIgnoredForOtherRotations() {
        ViewRequest.Builder builder = ViewRequest.builder(PROJECT, NodeClass.SUBJECT)
                .apply(FilterClause.of("category", "News", "##category:News"))
                .apply(FilterClause.of("country", "uk", "country:uk"))
                .apply(FilterClause.of("firstseen", "2020", "##firstseen:2020"));
        NodeQuery subject = composer.toQuery(builder.build());
        assertTrue(subject.categories().isEmpty());
        assertTrue(subject.attributes().isEmpty());
        assertTrue(subject.firstSeenYears().isEmpty());

        NodeQuery location = composer.toQuery(ViewRequest.builder(PROJECT, NodeClass.LOCATION)
                .apply(FilterClause.of("category", "News", "##category:News"))
                .apply(FilterClause.of("country", "uk", "country:uk"))
                .apply(FilterClause.of("firstseen", "2020", "##firstseen:2020"))
                .build());
        assertEquals(List.of("news"), location.categories());
        assertEquals(Map.of("country", List.of("uk")), location.attributes());
        assertEquals(List.of("2020"), location.firstSeenYears());
    }

    @Test
    public void locationFilters_narrowResults() {
        GridNode news = node("news", "location", "domain", "2024-01-02");
        news.setProperties(Map.of("category", "news"));
        news.getMetadata().put("temporal", Map.of("age_days", 400, "first_seen_year", "2019"));
        GridNode blog = node("blog", "location", "domain", "2024-01-03");
        blog.setProperties(Map.of("category", "blog"));
        blog.getMetadata().put("temporal", Map.of("age_days", 10, "first_seen_year", "2023"));
        store.put(PROJECT, news);
        store.put(PROJECT, blog);

        NodePage byCategory = composer.compose(ViewRequest.builder(PROJECT, NodeClass.LOCATION)
                .apply(FilterClause.of("category", "NEWS", "##category:NEWS")).build());
        assertEquals(List.of("news"), byCategory.nodes().stream().map(GridNode::getId).toList());

        NodePage byAge = composer.compose(ViewRequest.builder(PROJECT, NodeClass.LOCATION)
                .apply(FilterClause.of("agebucket", "1y+", "##agebucket:1y+")).build());
        assertEquals(List.of("news"), byAge.nodes().stream().map(GridNode::getId).toList());

        NodePage byYear = composer.compose(ViewRequest.builder(PROJECT, NodeClass.LOCATION)
                .apply(FilterClause.of("firstseenyear", "2023", "##firstseenyear:2023")).build());
        assertEquals(List.of("blog"), byYear.nodes().stream().map(GridNode::getId).toList());
    }

    @Test
    public void filterClauses_dispatchToOneEffectEach() {
        ViewRequest request = ViewRequest.builder(PROJECT, NodeClass.LOCATION)
                .apply(FilterClause.of("entitytype", "person", "##entitytype:person"))
                .apply(FilterClause.of("tags", "tag:x", "##tags:tag:x"))
                .apply(FilterClause.of("lastarchived", "2021", "##lastarchived:2021"))
                .apply(FilterClause.of("agebucket", "30d+", "##agebucket:30d+"))
                .apply(FilterClause.of("agebucket", "5y+", "##agebucket:5y+"))
                .apply(FilterClause.of("agebucket", "forever", "##agebucket:forever"))
                .apply(FilterClause.of("dates", "", "##dates:"))
                .build();
        assertEquals("person", request.type());
        assertEquals(List.of("tag:x"), request.pins());
        assertEquals(List.of("2021"), request.lastArchivedYears());
        assertEquals(Integer.valueOf(1825), request.minAgeDays());
        assertTrue(request.attributes().isEmpty());
    }

    @Test
    public void searchText_matchesLabelSubstring() {
        store.put(PROJECT, node("a", "subject", "person", "2024-01-01"));
        GridNode acme = node("acme", "subject", "company", "2024-01-02");
        acme.setLabel("ACME Holdings");
        store.put(PROJECT, acme);
        NodePage page = composer.compose(ViewRequest.builder(PROJECT, NodeClass.SUBJECT).searchText("holdings").build());
        assertEquals(List.of("acme"), page.nodes().stream().map(GridNode::getId).toList());
    }

    @Test
    public void blankProject_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> ViewRequest.builder(" ", NodeClass.SUBJECT));
    }
}
