package ai.gamedata.translator.markup;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ContextTrackerTest {

    @Test
    void enteringADepthClosesThatDepthAndDeeper() {
        ContextTracker tracker = new ContextTracker();
        tracker.enterObject(ObjectType.MISSION);
        tracker.open(2, BlockContext.CONVERSATION);
        tracker.open(3, BlockContext.CHOICE);

        tracker.enter(3);

        assertThat(tracker.snapshot()).containsOnlyKeys(0, 2);
        assertThat(tracker.inConversation()).isTrue();

        tracker.enter(2);

        assertThat(tracker.snapshot()).containsOnlyKeys(0);
        assertThat(tracker.inConversation()).isFalse();
        assertThat(tracker.objectType()).contains(ObjectType.MISSION);
    }

    @Test
    void openingReplacesTheTagAtThatDepth() {
        ContextTracker tracker = new ContextTracker();
        tracker.open(1, BlockContext.WORD);
        tracker.open(2, BlockContext.COMMODITY);

        tracker.open(1, BlockContext.COMMODITY);

        assertThat(tracker.snapshot()).containsExactlyEntriesOf(java.util.Map.of(1, BlockContext.COMMODITY));
    }

    @Test
    void topLevelConversationAllowsNarrativeWithoutNestedBlock() {
        ContextTracker tracker = new ContextTracker();
        tracker.enterObject(ObjectType.CONVERSATION);

        assertThat(tracker.inConversation()).isTrue();
        assertThat(tracker.narrativeAllowed()).isTrue();

        tracker.leaveObject();

        assertThat(tracker.objectType()).isEmpty();
        assertThat(tracker.narrativeAllowed()).isFalse();
    }

    @Test
    void wordBlockAllowsBacktickLinesButIsNotAConversation() {
        ContextTracker tracker = new ContextTracker();
        tracker.enterObject(ObjectType.PHRASE);
        tracker.apply(new Classification.OpenContext(1, BlockContext.WORD));

        assertThat(tracker.narrativeAllowed()).isTrue();
        assertThat(tracker.inConversation()).isFalse();
    }
}
