package com.synthetic.issuance.infra.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTokenTest {

    private final InMemoryToken token = new InMemoryToken("SUSD", "engine");

    @Nested
    @DisplayName("transfers")
    class Transfers {

        @Test
        @DisplayName("transferFrom spends the allowance granted to the recipient")
        void transferFromSpendsAllowance() {
            token.faucet("alice", BigInteger.TEN);
            token.approve("alice", "engine", BigInteger.valueOf(6));

            assertTrue(token.transferFrom("alice", "engine", BigInteger.valueOf(4)));

            assertEquals(BigInteger.TWO, token.allowance("alice", "engine"));
            assertEquals(BigInteger.valueOf(6), token.balanceOf("alice"));
            assertEquals(BigInteger.valueOf(4), token.balanceOf("engine"));
        }

        @Test
        @DisplayName("insufficient allowance or balance → refused, nothing moves")
        void refused() {
            token.faucet("alice", BigInteger.ONE);
            token.approve("alice", "engine", BigInteger.TEN);

            assertFalse(token.transferFrom("alice", "engine", BigInteger.TWO));
            assertFalse(token.transferFrom("bob", "engine", BigInteger.ONE));
            assertFalse(token.transfer("alice", "", BigInteger.ONE));

            assertEquals(BigInteger.ONE, token.balanceOf("alice"));
            assertEquals(BigInteger.TEN, token.allowance("alice", "engine"));
        }

        @Test
        @DisplayName("custodian reclaims a payout without any allowance, other accounts cannot")
        void reclaimByCustodianOnly() {
            token.faucet("engine", BigInteger.TEN);
            assertTrue(token.transfer("engine", "bob", BigInteger.valueOf(3)));

            assertFalse(token.reclaim("bob", "carol", BigInteger.valueOf(3)));
            assertTrue(token.reclaim("bob", "engine", BigInteger.valueOf(3)));
            assertFalse(token.reclaim("bob", "engine", BigInteger.ONE));

            assertEquals(BigInteger.ZERO, token.balanceOf("bob"));
            assertEquals(BigInteger.TEN, token.balanceOf("engine"));
            assertEquals(BigInteger.ZERO, token.allowance("bob", "engine"));
        }

        @Test
        @DisplayName("negative allowance is rejected")
        void negativeAllowance() {
            assertThrows(IllegalArgumentException.class,
                    () -> token.approve("alice", "engine", BigInteger.valueOf(-1)));
        }
    }

    @Nested
    @DisplayName("mint and burn")
    class Supply {

        @Test
        @DisplayName("mint refuses blank recipients and non-positive amounts")
        void mintRefusals() {
            assertFalse(token.mint(" ", BigInteger.ONE));
            assertFalse(token.mint("alice", BigInteger.ZERO));
            assertTrue(token.mint("alice", BigInteger.TEN));
            assertEquals(BigInteger.TEN, token.totalSupply());
        }

        @Test
        @DisplayName("only the minter may burn, and only what it holds")
        void burnRules() {
            token.mint("engine", BigInteger.TEN);
            token.mint("alice", BigInteger.TEN);

            assertThrows(IllegalStateException.class, () -> token.burn("alice", BigInteger.ONE));
            assertThrows(IllegalStateException.class, () -> token.burn("engine", BigInteger.valueOf(11)));
            assertThrows(IllegalStateException.class, () -> token.burn("engine", BigInteger.ZERO));

            token.burn("engine", BigInteger.valueOf(4));
            assertEquals(BigInteger.valueOf(6), token.balanceOf("engine"));
            assertEquals(BigInteger.valueOf(16), token.totalSupply());
        }
    }

    @Test
    @DisplayName("directory finds tokens by symbol, case-insensitively, with a synthetic alias")
    void directoryLookup() {
        InMemoryToken weth = new InMemoryToken("WETH", "engine");
        TokenDirectory directory = new TokenDirectory(token, List.of(weth));

        assertSame(weth, directory.find("weth").orElseThrow());
        assertSame(token, directory.find("susd").orElseThrow());
        assertSame(token, directory.find(TokenDirectory.SYNTHETIC_ALIAS).orElseThrow());
        assertTrue(directory.find("DOGE").isEmpty());
        assertTrue(directory.find(null).isEmpty());
    }
}
