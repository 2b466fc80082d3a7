package org.csu.vhdlfmt.formatter;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: 配置声明格式化的单元测试
 *
 * 已是规范格式的输入应原样输出；其余输入给出期望的规范格式。
 */
public class ConfigurationFormatterTest {

    private final VhdlFormatter formatter = new VhdlFormatter();

    private void assertFormatted(String canonical) {
        assertEquals(canonical + "\n", formatter.format(canonical));
    }

    private void assertFormatsTo(String input, String expected) {
        assertEquals(expected + "\n", formatter.format(input));
    }

    @Test
    void testMinimalConfiguration() {
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                    end for;
                end;""");
    }

    @Test
    void testClosingForms() {
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                    end for;
                end configuration cfg;""");
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                    end for;
                end configuration;""");
    }

    @Test
    void testDeclarations() {
        assertFormatted("""
                configuration cfg of entity_name is
                    use lib.foo.bar;
                    use lib2.foo.bar;
                    for rtl(0)
                    end for;
                end configuration cfg;""");
    }

    @Test
    void testBlankLineBeforeRootBlockIsKept() {
        assertFormatted("""
                configuration cfg of entity_name is
                    use lib.foo.bar;
                    use lib2.foo.bar;

                    for rtl(0)
                    end for;
                end configuration cfg;""");
        assertFormatsTo("""
                configuration cfg of entity_name is
                  use lib.foo.bar; use lib2.foo.bar;



                for rtl(0) end for;
                end configuration cfg;""", """
                configuration cfg of entity_name is
                    use lib.foo.bar;
                    use lib2.foo.bar;

                    for rtl(0)
                    end for;
                end configuration cfg;""");
    }

    @Test
    void testNestedBlocks() {
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                        for name(0 to 3)
                        end for;
                        for other_name
                        end for;
                    end for;
                end configuration cfg;""");
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                        for name(0 to 3)
                            for name(7 to 8)
                            end for;
                        end for;
                        for other_name
                        end for;
                    end for;
                end configuration cfg;""");
    }

    @Test
    void testVUnitBindings() {
        assertFormatted("""
                configuration cfg of entity_name is
                    use lib.foo.bar;
                    use vunit baz.foobar;
                    for rtl(0)
                    end for;
                end configuration cfg;""");
        assertFormatsTo("""
                configuration cfg of e is
                use vunit a,b.c ,   d;
                for rtl end for; end;""", """
                configuration cfg of e is
                    use vunit a, b.c, d;
                    for rtl
                    end for;
                end;""");
    }

    @Test
    void testComponentConfigurations() {
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                        for inst: lib.pkg.comp
                            for arch
                            end for;
                        end for;
                    end for;
                end configuration cfg;""");
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                        for inst: lib.pkg.comp
                            use entity work.bar;
                            use vunit baz;
                            for arch
                            end for;
                        end for;
                    end for;
                end configuration cfg;""");
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                        for inst: lib.pkg.comp
                            use entity lib.use_name;
                        end for;
                    end for;
                end configuration cfg;""");
    }

    @Test
    void testInstantiationLists() {
        assertFormatted("""
                configuration cfg of entity_name is
                    for rtl(0)
                        for inst: lib.pkg.comp
                        end for;
                        for inst1, inst2, inst3: lib2.pkg.comp
                        end for;
                        for all: lib3.pkg.comp
                        end for;
                        for others: lib4.pkg.comp
                        end for;
                    end for;
                end configuration cfg;""");
    }

    @Test
    void testIrregularLabelSpacingIsNormalized() {
        assertFormatsTo("""
                configuration cfg of entity_name is
                for rtl(0)
                for inst1 ,inst2,   inst3 :lib2.pkg.comp
                end for;
                end for;
                end configuration cfg;""", """
                configuration cfg of entity_name is
                    for rtl(0)
                        for inst1, inst2, inst3: lib2.pkg.comp
                        end for;
                    end for;
                end configuration cfg;""");
    }

    @Test
    void testEntityAspects() {
        assertFormatted("""
                configuration cfg of entity_name is
                    for foo
                        for inst: lib.pkg.comp
                            use entity lib.foo.name(arch);
                        end for;
                    end for;
                end configuration cfg;""");
        assertFormatted("""
                configuration cfg of entity_name is
                    for foo
                        for inst: lib.pkg.comp
                            use configuration lib.foo.name;
                        end for;
                    end for;
                end configuration cfg;""");
        assertFormatted("""
                configuration cfg of entity_name is
                    for foo
                        for inst: lib.pkg.comp
                            use open;
                        end for;
                    end for;
                end configuration cfg;""");
    }

    @Test
    void testArchitectureSuffixHasNoSpace() {
        assertFormatsTo("""
                configuration cfg of e is for foo for inst: comp
                use entity lib.foo.name ( arch ) ; end for; end for; end;""", """
                configuration cfg of e is
                    for foo
                        for inst: comp
                            use entity lib.foo.name(arch);
                        end for;
                    end for;
                end;""");
    }

    @Test
    void testMapAspects() {
        assertFormatsTo("""
                configuration cfg of e is for rtl for u1: comp use entity work.e(rtl)
                generic map (WIDTH=>8, DEPTH => 2**4) port map (clk=>clk, q=>open); end for; end for; end;""", """
                configuration cfg of e is
                    for rtl
                        for u1: comp
                            use entity work.e(rtl)
                                generic map (
                                    WIDTH => 8,
                                    DEPTH => 2 ** 4
                                )
                                port map (
                                    clk => clk,
                                    q => open
                                );
                        end for;
                    end for;
                end;""");
    }

    @Test
    void testPortMapWithoutEntityAspect() {
        assertFormatted("""
                configuration cfg of e is
                    for rtl
                        for u1: comp
                            use
                                port map (
                                    a => b
                                );
                        end for;
                    end for;
                end;""");
    }

    @Test
    void testExpressionsInMaps() {
        assertFormatsTo("""
                configuration cfg of e is for rtl for u1: comp use entity work.e generic map (
                INIT=>(others=>'0'), DELAY=>10 ns, OFFSET=>-1, FLAG=>not enable,
                MASK=>x"0F"&x"F0", LAST=>sig'length-1, SEL=>(1|2=>'1', others=>'0'), F=>f(a,b)
                ); end for; end for; end;""", """
                configuration cfg of e is
                    for rtl
                        for u1: comp
                            use entity work.e
                                generic map (
                                    INIT => (others => '0'),
                                    DELAY => 10 ns,
                                    OFFSET => -1,
                                    FLAG => not enable,
                                    MASK => x"0F" & x"F0",
                                    LAST => sig'length - 1,
                                    SEL => (1 | 2 => '1', others => '0'),
                                    F => f(a, b)
                                );
                        end for;
                    end for;
                end;""");
    }

    @Test
    void testBlockSpecNames() {
        assertFormatted("""
                configuration cfg of e is
                    for rtl
                        for gen(3 downto 0)
                        end for;
                        for blk(sig'length - 1 downto 0)
                        end for;
                        for lbl(i)
                        end for;
                    end for;
                end;""");
    }

    @Test
    void testContextClause() {
        assertFormatted("""
                library ieee, work;
                use ieee.std_logic_1164.all;
                context lib.ctx;

                configuration cfg of e is
                    for rtl
                    end for;
                end;""");
        assertFormatsTo("""
                library ieee; use ieee.std_logic_1164.all;
                configuration cfg of e is for rtl end for; end;""", """
                library ieee;
                use ieee.std_logic_1164.all;
                configuration cfg of e is
                    for rtl
                    end for;
                end;""");
    }

    @Test
    void testDesignUnitsAreSeparatedByOneBlankLine() {
        String expected = """
                configuration a of e is
                    for rtl
                    end for;
                end;

                configuration b of e is
                    for rtl
                    end for;
                end;""";
        assertFormatsTo("""
                configuration a of e is for rtl end for; end; configuration b of e is for rtl end for; end;""",
                expected);
        assertFormatsTo("""
                configuration a of e is for rtl end for; end;




                configuration b of e is for rtl end for; end;""", expected);
    }

    @Test
    void testCommentsArePreserved() {
        String canonical = """
                -- top comment
                configuration cfg of e is
                    -- the root block
                    for rtl -- architecture
                        for u1: comp
                            /* binding */
                            use entity work.e;
                        end for;
                    end for;
                end;
                -- trailing comment
                """;
        assertEquals(canonical, formatter.format(canonical));
    }

    @Test
    void testCommentIndentationFollowsCode() {
        assertFormatsTo("""
                configuration cfg of e is
                for rtl
                -- first instance
                for u1: comp
                end for;
                end for;
                end;""", """
                configuration cfg of e is
                    for rtl
                        -- first instance
                        for u1: comp
                        end for;
                    end for;
                end;""");
    }

    @Test
    void testKeywordCaseIsPreserved() {
        assertFormatsTo("""
                CONFIGURATION Cfg OF Ent IS FOR Rtl END FOR; END CONFIGURATION Cfg;""", """
                CONFIGURATION Cfg OF Ent IS
                    FOR Rtl
                    END FOR;
                END CONFIGURATION Cfg;""");
    }

    @Test
    void testCustomIndentation() {
        VhdlFormatter twoSpaces = new VhdlFormatter(new FormatOptions(2, false, 1, 256));
        assertEquals("""
                configuration cfg of e is
                  for rtl
                    for u1: comp
                    end for;
                  end for;
                end;
                """, twoSpaces.format("configuration cfg of e is for rtl for u1: comp end for; end for; end;"));

        VhdlFormatter tabs = new VhdlFormatter(new FormatOptions(4, true, 1, 256));
        assertEquals("configuration cfg of e is\n\tfor rtl\n\tend for;\nend;\n",
                tabs.format("configuration cfg of e is for rtl end for; end;"));
    }

    @Test
    void testConfigurationSpecification() {
        assertEquals("for u1: comp\n    use entity work.e;\n",
                formatter.formatConfigurationSpecification("for u1 : comp use entity work.e;"));
        assertEquals("for u1: comp\n    use entity work.e;\nend for;\n",
                formatter.formatConfigurationSpecification("for u1:comp use entity work.e; end for;"));
        assertEquals("for all: comp\n    use entity work.e;\n    use vunit v1, v2;\nend for;\n",
                formatter.formatConfigurationSpecification("for all : comp use entity work.e; use vunit v1,v2; end   for ;"));
    }

    @Test
    void testIsFormatted() {
        assertTrue(formatter.isFormatted("configuration cfg of e is\n    for rtl\n    end for;\nend;\n"));
        assertFalse(formatter.isFormatted("configuration cfg of e is\n    for rtl\n    end for;\nend;"));
        assertFalse(formatter.isFormatted("configuration cfg of e is for rtl end for; end;\n"));
    }

    @Test
    void testEmptySource() {
        assertEquals("", formatter.format(""));
        assertEquals("-- only a comment\n", formatter.format("\n\n-- only a comment\n\n\n"));
    }
}
