package com.fstner.infrastructure.transducer;

import com.fstner.domain.recognition.model.RecognizedEntity;
import com.fstner.infrastructure.transducer.exception.UnknownStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class FiniteStateTransducerTest {

    private static final String CAPITALIZED = "\\p{Lu}\\p{Ll}+";
    private static final String EMAIL = "[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)*\\.[a-z]{2,}";

    private FiniteStateTransducer transducer;

    @BeforeEach
    void setUp() {
        TransitionTable table = TransitionTable.builder()
                .addState("q0")
                .addState("first-name")
                .addState("person")
                .addState("email")
                .addTransition("q0", EMAIL, "email", "EMAIL")
                .addTransition("q0", CAPITALIZED, "first-name")
                .addTransition("first-name", CAPITALIZED, "person", "PERSON")
                .build();
        transducer = new FiniteStateTransducer(table);
    }

    @Nested
    @DisplayName("Emission")
    class EmissionTests {

        @Test
        @DisplayName("Two capitalized words form one PERSON, trailing text is dropped")
        void two_token_person() {
            List<RecognizedEntity> result = transducer.run("q0", List.of("Kovács", "János", "lakik"));

            assertThat(result).containsExactly(new RecognizedEntity("Kovács János", "PERSON"));
        }

        @Test
        void single_token_email() {
            List<RecognizedEntity> result = transducer.run("q0", List.of("kovacs.janos@example.com"));

            assertThat(result).containsExactly(new RecognizedEntity("kovacs.janos@example.com", "EMAIL"));
        }

        @Test
        @DisplayName("Tokens that match nothing at the initial state never reach the output")
        void unmatched_text_omitted() {
            assertThat(transducer.run("q0", List.of("hello", "world"))).isEmpty();
        }

        @Test
        void empty_input() {
            assertThat(transducer.run("q0", List.of())).isEmpty();
            assertThat(transducer.run("q0", null)).isEmpty();
        }

        @Test
        @DisplayName("Entities come out in input order")
        void input_order() {
            List<RecognizedEntity> result = transducer.run("q0",
                    List.of("a@example.com", "és", "Kovács", "János", "meg", "b@example.org"));

            assertThat(result)
                    .extracting(RecognizedEntity::text, RecognizedEntity::category)
                    .containsExactly(
                            tuple("a@example.com", "EMAIL"),
                            tuple("Kovács János", "PERSON"),
                            tuple("b@example.org", "EMAIL"));
        }

        @Test
        @DisplayName("A labeled transition returns the machine to the initial state")
        void label_resets_to_initial() {
            TransitionTable table = TransitionTable.builder()
                    .addState("q0").addState("q1").addState("q2")
                    .addTransition("q0", "A", "q1", "FIRST")
                    .addTransition("q1", "B", "q2", "SECOND")
                    .build();

            List<RecognizedEntity> result = new FiniteStateTransducer(table).run("q0", List.of("A", "B"));

            assertThat(result).containsExactly(new RecognizedEntity("A", "FIRST"));
        }

        @Test
        @DisplayName("Earliest registered transition wins when several match")
        void first_registered_wins() {
            TransitionTable table = TransitionTable.builder()
                    .addState("q0").addState("a").addState("b")
                    .addTransition("q0", "x", "a", "FIRST")
                    .addTransition("q0", "[a-z]", "b", "SECOND")
                    .build();

            List<RecognizedEntity> result = new FiniteStateTransducer(table).run("q0", List.of("x"));

            assertThat(result).containsExactly(new RecognizedEntity("x", "FIRST"));
        }

        @Test
        void contains_mode_transition() {
            TransitionTable table = TransitionTable.builder()
                    .addState("q0").addState("tag")
                    .addTransition("q0", "^#\\w", "tag", "HASHTAG", MatchMode.CONTAINS)
                    .build();

            List<RecognizedEntity> result = new FiniteStateTransducer(table).run("q0", List.of("#fst", "fst#"));

            assertThat(result).containsExactly(new RecognizedEntity("#fst", "HASHTAG"));
        }
    }

    @Nested
    @DisplayName("Broken multi-token matches")
    class BrokenMatchTests {

        @Test
        @DisplayName("A broken person match emits nothing")
        void broken_person_discarded() {
            assertThat(transducer.run("q0", List.of("Kovács", "lakik"))).isEmpty();
        }

        @Test
        @DisplayName("The breaking token is retried from the initial state")
        void breaking_token_retried() {
            List<RecognizedEntity> result = transducer.run("q0", List.of("Kovács", "kovacs@example.com"));

            assertThat(result).containsExactly(new RecognizedEntity("kovacs@example.com", "EMAIL"));
        }

        @Test
        @DisplayName("A token failing the retry is skipped and the next token starts fresh")
        void failed_retry_skips_token() {
            List<RecognizedEntity> result = transducer.run("q0", List.of("Kovács", "123", "János", "Péter"));

            assertThat(result).containsExactly(new RecognizedEntity("János Péter", "PERSON"));
        }

        @Test
        @DisplayName("A breaking token can open a new multi-token match")
        void breaking_token_opens_new_match() {
            TransitionTable table = TransitionTable.builder()
                    .addState("q0").addState("num").addState("word")
                    .addTransition("q0", "\\d+", "num")
                    .addTransition("num", "kg", "q0", "WEIGHT")
                    .addTransition("q0", "[a-z]+", "word")
                    .addTransition("word", "!", "q0", "SHOUT")
                    .build();

            List<RecognizedEntity> result = new FiniteStateTransducer(table)
                    .run("q0", List.of("12", "hey", "!"));

            assertThat(result).containsExactly(new RecognizedEntity("hey !", "SHOUT"));
        }

        @Test
        @DisplayName("An unfinished span at the end of input is dropped")
        void residual_span_dropped() {
            assertThat(transducer.run("q0", List.of("hello", "Kovács"))).isEmpty();
        }

        @Test
        @DisplayName("A pending span routed back to the initial state is dropped on mismatch")
        void pending_at_initial_dropped() {
            TransitionTable table = TransitionTable.builder()
                    .addState("q0").addState("done")
                    .addTransition("q0", "a", "q0")
                    .addTransition("q0", "b", "done", "AB")
                    .build();
            FiniteStateTransducer loop = new FiniteStateTransducer(table);

            assertThat(loop.run("q0", List.of("a", "b"))).containsExactly(new RecognizedEntity("a b", "AB"));
            assertThat(loop.run("q0", List.of("a", "x", "b"))).containsExactly(new RecognizedEntity("b", "AB"));
        }
    }

    @Nested
    @DisplayName("Run properties")
    class PropertyTests {

        @Test
        @DisplayName("Same table and tokens give the same output")
        void idempotent() {
            List<String> tokens = List.of("Kovács", "János", "x@y.hu", "Nagy", "lakik", "Kis", "Anna");

            assertThat(transducer.run("q0", tokens)).isEqualTo(transducer.run("q0", tokens));
        }

        @Test
        @DisplayName("Runs terminate on inputs that keep breaking matches")
        void terminates_on_cyclic_table() {
            TransitionTable table = TransitionTable.builder()
                    .addState("q0").addState("q1")
                    .addTransition("q0", "a", "q1")
                    .addTransition("q1", "a", "q0")
                    .build();
            FiniteStateTransducer cyclic = new FiniteStateTransducer(table);

            List<String> tokens = new ArrayList<>();
            for (int i = 0; i < 50_000; i++) {
                tokens.add(i % 3 == 2 ? "b" : "a");
            }

            List<RecognizedEntity> result = assertTimeoutPreemptively(Duration.ofSeconds(5),
                    () -> cyclic.run("q0", tokens));
            assertThat(result).isEmpty();
        }

        @Test
        void unknown_initial_state_rejected() {
            assertThatThrownBy(() -> transducer.run("nowhere", List.of("Kovács")))
                    .isInstanceOf(UnknownStateException.class);
        }

        @Test
        @DisplayName("Concurrent runs over one table do not interfere")
        void concurrent_runs() throws Exception {
            List<String> tokens = List.of("Kovács", "János", "lakik", "x@y.hu");
            List<RecognizedEntity> expected = transducer.run("q0", tokens);

            List<Thread> threads = new ArrayList<>();
            List<List<RecognizedEntity>> results = Collections.synchronizedList(new ArrayList<>());
            for (int i = 0; i < 8; i++) {
                Thread thread = new Thread(() -> {
                    for (int j = 0; j < 200; j++) {
                        results.add(transducer.run("q0", tokens));
                    }
                });
                threads.add(thread);
                thread.start();
            }
            for (Thread thread : threads) {
                thread.join();
            }

            assertThat(results).hasSize(1600).allSatisfy(r -> assertThat(r).isEqualTo(expected));
        }
    }
}
