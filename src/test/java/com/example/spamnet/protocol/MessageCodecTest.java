package com.example.spamnet.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MessageCodecTest {

    @Test
    public void unwrapsStringEncodedJsonRecursively() throws Exception {
        JsonElement in = MessageCodec.parseStrict(
                "{\"key1\": \"{\\\"nested_key1\\\": \\\"nested_value1\\\"}\", "
                        + "\"key2\": [\"{\\\"nested_key2\\\": \\\"nested_value2\\\"}\"]}");
        JsonElement expected = JsonParser.parseString(
                "{\"key1\": {\"nested_key1\": \"nested_value1\"}, \"key2\": [{\"nested_key2\": \"nested_value2\"}]}");
        assertEquals(expected, MessageCodec.unwrapNested(in));
    }

    @Test
    public void unwrapsMoreThanOneLayer() {
        JsonObject innermost = new JsonObject();
        innermost.addProperty("x", 1);
        JsonObject middle = new JsonObject();
        middle.addProperty("q", innermost.toString());
        JsonObject outer = new JsonObject();
        outer.addProperty("p", middle.toString());

        JsonElement out = MessageCodec.unwrapNested(outer);
        assertEquals(JsonParser.parseString("{\"p\":{\"q\":{\"x\":1}}}"), out);
    }

    @Test
    public void peelsStackedStringEncoding() throws Exception {
        JsonElement in = MessageCodec.parseStrict("{\"p\":\"\\\"{\\\\\\\"x\\\\\\\":1}\\\"\"}");
        assertEquals("\"{\\\"x\\\":1}\"", in.getAsJsonObject().get("p").getAsString());
        assertEquals(JsonParser.parseString("{\"p\":{\"x\":1}}"), MessageCodec.unwrapNested(in));
    }

    @Test
    public void encodedScalarUnwrapsToStringNotNumber() {
        JsonObject o = new JsonObject();
        o.addProperty("id", "\"123\"");
        JsonElement out = MessageCodec.unwrapNested(o).getAsJsonObject().get("id");
        assertTrue(out.getAsJsonPrimitive().isString());
        assertEquals("123", out.getAsString());
    }

    @Test
    public void leavesScalarLookingStringsAlone() {
        JsonObject o = new JsonObject();
        o.addProperty("id", "123456");
        o.addProperty("flag", "true");
        o.addProperty("text", "{not json");
        o.addProperty("plain", "hello");
        JsonElement out = MessageCodec.unwrapNested(o);
        assertEquals(o, out);
        assertTrue(out.getAsJsonObject().get("id").getAsJsonPrimitive().isString());
    }

    @Test
    public void decodesEnvelopeWithStringPayload() throws Exception {
        String text = "{\"kind\":\"report-spammer\",\"origin_id\":\"n1\",\"ts\":5,"
                + "\"payload\":\"{\\\"identifier\\\":\\\"42\\\",\\\"note\\\":\\\"x\\\",\\\"timestamp\\\":7}\"}";
        MessageEnvelope env = MessageCodec.decode(text);
        assertEquals(MessageKind.REPORT_SPAMMER, env.kind());
        assertEquals("n1", env.originId());
        assertEquals(5L, env.ts());
        Payloads.ReportSpammer p = MessageCodec.payloadAs(env, Payloads.ReportSpammer.class);
        assertEquals("42", p.identifier);
        assertEquals(7L, p.timestamp);
    }

    @Test
    public void rejectsInvalidText() {
        String[] bad = {
                "{\"kind\":\"x\"",
                "{\"kind\":\"x\",\"origin_id\":\"n\"} trailing",
                "[1,2]",
                "{kind:x}",
                "{\"origin_id\":\"n\"}",
                "{\"kind\":\"x\"}"
        };
        for (String text : bad) {
            try {
                MessageCodec.decode(text);
                fail("accepted: " + text);
            } catch (MessageCodec.DecodeException expected) {
                // rejected
            }
        }
    }

    @Test
    public void encodeThenDecodeKeepsFields() throws Exception {
        JsonObject payload = new JsonObject();
        payload.addProperty("identifier", "<b>&'");
        MessageEnvelope env = MessageEnvelope.create(MessageKind.QUERY_SPAMMER, "node-a", 99L, payload);
        String text = MessageCodec.encode(env);
        assertTrue(text.contains("\"origin_id\":\"node-a\""));
        assertTrue(text.contains("<b>&'"));
        MessageEnvelope back = MessageCodec.decode(text);
        assertEquals(env.kind(), back.kind());
        assertEquals(payload, back.payload());
    }

    @Test
    public void dedupKeyIgnoresKeyOrderAndEncodingButNotOrigin() throws Exception {
        MessageEnvelope a = MessageCodec.decode(
                "{\"kind\":\"report-spammer\",\"origin_id\":\"n1\",\"ts\":1,\"payload\":{\"identifier\":\"9\",\"timestamp\":3}}");
        MessageEnvelope b = MessageCodec.decode(
                "{\"kind\":\"report-spammer\",\"origin_id\":\"n1\",\"ts\":2,\"payload\":\"{\\\"timestamp\\\":3,\\\"identifier\\\":\\\"9\\\"}\"}");
        MessageEnvelope c = MessageCodec.decode(
                "{\"kind\":\"report-spammer\",\"origin_id\":\"n2\",\"ts\":1,\"payload\":{\"identifier\":\"9\",\"timestamp\":3}}");
        assertEquals(MessageCodec.dedupKey(a), MessageCodec.dedupKey(b));
        assertNotEquals(MessageCodec.dedupKey(a), MessageCodec.dedupKey(c));
        assertTrue(MessageCodec.dedupKey(a).startsWith("n1:"));
    }

    @Test
    public void jsonNoteSurvivesDecodeAndKeepsItsDedupKey() throws Exception {
        String note = "{\"reason\":\"crypto scam\"}";
        Payloads.ReportSpammer p = new Payloads.ReportSpammer();
        p.identifier = "777";
        p.note = Payloads.noteTree(note);
        p.timestamp = 10;
        MessageEnvelope local = MessageEnvelope.create(MessageKind.REPORT_SPAMMER, "n1", MessageCodec.toTree(p));

        MessageEnvelope echo = MessageCodec.decode(MessageCodec.encode(local));
        assertFalse(echo.payload().getAsJsonObject().get("note").isJsonPrimitive());
        Payloads.ReportSpammer back = MessageCodec.payloadAs(echo, Payloads.ReportSpammer.class);
        assertEquals(note, Payloads.noteText(back.note));
        assertEquals(MessageCodec.dedupKey(local), MessageCodec.dedupKey(echo));
    }

    @Test
    public void envelopePayloadIsACopy() {
        JsonObject payload = new JsonObject();
        payload.addProperty("identifier", "1");
        MessageEnvelope env = MessageEnvelope.create(MessageKind.REPORT_SPAMMER, "n", payload);
        payload.addProperty("identifier", "2");
        env.payload().getAsJsonObject().addProperty("identifier", "3");
        assertEquals("1", env.payload().getAsJsonObject().get("identifier").getAsString());
    }
}
