package utils;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FieldResolverTest {

    private static JsonObject json(String text) {
        return JsonParser.parseString(text).getAsJsonObject();
    }

    @Test
    void firstPresentPathShouldWin() {
        FieldResolver resolver = FieldResolver.of("member", "members");
        JsonObject both = json("{\"member\":[{\"id\":1}],\"members\":[{\"id\":2},{\"id\":3}]}");
        JsonObject onlySecond = json("{\"members\":[{\"id\":2}]}");

        assertEquals(1, resolver.resolveArray(both).size());
        assertEquals(1, resolver.resolveArray(onlySecond).size());
        assertEquals(2, resolver.resolveArray(onlySecond).get(0).getAsJsonObject().get("id").getAsInt());
    }

    @Test
    void emptyValuesShouldFallThroughToLaterPaths() {
        FieldResolver resolver = FieldResolver.of("playerName", "name");

        assertEquals("Rey", resolver.resolveString(json("{\"playerName\":\"  \",\"name\":\"Rey\"}")));
        assertEquals("Rey", resolver.resolveString(json("{\"playerName\":null,\"name\":\"Rey\"}")));
        assertNull(resolver.resolveString(json("{\"other\":\"x\"}")));

        FieldResolver arrays = FieldResolver.of("member", "members");
        assertEquals(1, arrays.resolveArray(json("{\"member\":[],\"members\":[{}]}")).size());
    }

    @Test
    void nestedPathsShouldWalkObjects() {
        FieldResolver resolver = FieldResolver.of("playerRating.playerRankStatus.leagueId");
        JsonObject payload = json("{\"playerRating\":{\"playerRankStatus\":{\"leagueId\":\"KYBER\"}}}");

        assertEquals("KYBER", resolver.resolveString(payload));
        assertNull(resolver.resolveString(json("{\"playerRating\":\"flat\"}")));
    }

    @Test
    void typedResolversShouldSkipWrongShapes() {
        FieldResolver ints = FieldResolver.of("memberLevel", "role");
        assertEquals(3, ints.resolveInt(json("{\"memberLevel\":\"officer\",\"role\":3}")));
        assertEquals(4, ints.resolveInt(json("{\"memberLevel\":\"4\"}")));
        assertNull(ints.resolveInt(json("{\"memberLevel\":\"leader\"}")));

        FieldResolver longs = FieldResolver.of("galacticPower", "gp");
        assertEquals(9876543210L, longs.resolveLong(json("{\"galacticPower\":9876543210}")));
        assertEquals(12L, longs.resolveLong(json("{\"galacticPower\":{},\"gp\":\"12\"}")));

        FieldResolver objects = FieldResolver.of("guild", "payload.guild");
        assertEquals("x", objects.resolveObject(json("{\"guild\":[1],\"payload\":{\"guild\":{\"n\":\"x\"}}}")).get("n").getAsString());
    }

    @Test
    void resolverNeedsAtLeastOnePath() {
        assertThrows(IllegalArgumentException.class, FieldResolver::of);
    }
}
