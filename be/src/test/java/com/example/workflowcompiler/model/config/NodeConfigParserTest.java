package com.example.workflowcompiler.model.config;

import com.example.workflowcompiler.model.NodeType;
import com.example.workflowcompiler.model.RetryPolicy;
import com.example.workflowcompiler.model.WorkflowNode;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("NodeConfigParser")
class NodeConfigParserTest {

    private static WorkflowNode node(NodeType type, Map<String, Object> config) {
        return new WorkflowNode("n1", type, "Node", config, null, null);
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("http_call defaults the method to GET and upper-cases it")
        void httpCall() {
            HttpCallConfig defaults = (HttpCallConfig) NodeConfigParser.parse(node(NodeType.HTTP_CALL, Map.of("url", "https://x")));
            assertEquals("GET", defaults.method());
            HttpCallConfig post = (HttpCallConfig) NodeConfigParser.parse(
                    node(NodeType.HTTP_CALL, Map.of("url", "https://x", "method", "post", "timeout", "15s")));
            assertEquals("POST", post.method());
            assertEquals(Duration.ofSeconds(15), post.timeout());
        }

        @Test
        @DisplayName("wait_timer accepts duration_seconds or a duration string")
        void timer() {
            TimerConfig seconds = (TimerConfig) NodeConfigParser.parse(node(NodeType.WAIT_TIMER, Map.of("duration_seconds", 90)));
            assertEquals(Duration.ofSeconds(90), seconds.duration());
            TimerConfig text = (TimerConfig) NodeConfigParser.parse(node(NodeType.WAIT_TIMER, Map.of("duration", "2h")));
            assertEquals(Duration.ofHours(2), text.duration());
        }

        @Test
        @DisplayName("transform keeps mappings sorted by target")
        void transform() {
            TransformConfig config = (TransformConfig) NodeConfigParser.parse(
                    node(NodeType.TRANSFORM, Map.of("mappings", Map.of("z", "a", "b", "c"))));
            assertEquals("b", config.mappings().firstKey());
            assertNull(config.timeout());
        }

        @Test
        @DisplayName("control nodes ignore their payload")
        void controlNodes() {
            assertSame(ControlConfig.INSTANCE, NodeConfigParser.parse(node(NodeType.DECISION, Map.of("anything", 1))));
            assertInstanceOf(ActivityConfig.class, NodeConfigParser.parse(node(NodeType.ACTIVITY, null)));
        }
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        @DisplayName("missing required keys, naming the key")
        void missingKeys() {
            InvalidNodeConfigException url = assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.HTTP_CALL, Map.of())));
            assertEquals("config.url", url.getKey());
            InvalidNodeConfigException signal = assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.WAIT_SIGNAL, Map.of("signal_name", " "))));
            assertEquals("config.signal_name", signal.getKey());
            InvalidNodeConfigException timer = assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.WAIT_TIMER, Map.of())));
            assertEquals("config.duration", timer.getKey());
        }

        @Test
        @DisplayName("values of the wrong shape")
        void wrongShapes() {
            assertEquals("config.method", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.HTTP_CALL, Map.of("url", "u", "method", "FETCH")))).getKey());
            assertEquals("config.channel", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.NOTIFICATION, Map.of("channel", "pigeon")))).getKey());
            assertEquals("config.duration_seconds", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.WAIT_TIMER, Map.of("duration_seconds", -5)))).getKey());
            assertEquals("config.timeout", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.ACTIVITY, Map.of("timeout", "soon")))).getKey());
        }

        @Test
        @DisplayName("timer durations that round down to zero")
        void subMillisecondTimer() {
            InvalidNodeConfigException seconds = assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.WAIT_TIMER, Map.of("duration_seconds", 0.0004))));
            assertEquals("config.duration_seconds", seconds.getKey());
            assertEquals("config.duration", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.WAIT_TIMER, Map.of("duration", "0.0004")))).getKey());
        }

        @Test
        @DisplayName("durations too large to represent")
        void overflowingDuration() {
            assertEquals("config.duration", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parse(node(NodeType.WAIT_TIMER, Map.of("duration", "99999999999999999999d")))).getKey());
        }
    }

    @Nested
    @DisplayName("parseRetryPolicy")
    class Retries {

        @Test
        @DisplayName("returns null without a policy and fills runtime defaults")
        void defaults() {
            assertNull(NodeConfigParser.parseRetryPolicy(null));
            RetrySettings settings = NodeConfigParser.parseRetryPolicy(new RetryPolicy(null, "1s", null, null));
            assertEquals(0, settings.maxAttempts());
            assertEquals(2.0, settings.backoffCoefficient());
            assertEquals(Duration.ofSeconds(1), settings.initialInterval());
            assertNull(settings.maxInterval());
        }

        @Test
        @DisplayName("rejects out-of-range fields")
        void outOfRange() {
            assertEquals("retries.max_attempts", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parseRetryPolicy(new RetryPolicy(-1, null, null, null))).getKey());
            assertEquals("retries.backoff_coefficient", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parseRetryPolicy(new RetryPolicy(3, null, null, 0.5))).getKey());
            assertEquals("retries.max_interval", assertThrows(InvalidNodeConfigException.class,
                    () -> NodeConfigParser.parseRetryPolicy(new RetryPolicy(3, "1m", "1s", 2.0))).getKey());
        }
    }
}
