package com.ciro.qform.render;

import com.ciro.qform.model.Attribute;
import com.ciro.qform.model.Field;
import com.ciro.qform.model.FormModel;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HtmlFormRendererTest {

    private final HtmlFormRenderer renderer = new HtmlFormRenderer();

    private static FormModel contactModel() {
        return new FormModel()
                .addAttribute(new Attribute("method", "post"))
                .addField(Field.builder("text")
                        .name("name").attribute("name", "name")
                        .attribute("maxlength", "30")
                        .attribute("required", null)
                        .build())
                .addField(Field.builder("submit")
                        .attribute("value", "Send message")
                        .build());
    }

    @Test
    void rendersLabelledInputAndUnlabelledSubmit() {
        String expected = """
                <form method="post">
                  <div class="form-group">
                    <label for="name">Name</label>
                    <input type="text" name="name" maxlength="30" required="required" id="name" />
                  </div>
                  <div class="form-group">
                    <input type="submit" value="Send message" name="field2" id="field2" />
                  </div>
                </form>
                """;
        assertEquals(expected, renderer.render(contactModel()));
    }

    @Test
    void renderingIsIdempotentAndLeavesTheModelAlone() {
        FormModel model = contactModel();
        String first = renderer.render(model);
        String second = renderer.render(model);

        assertEquals(first, second);
        assertNull(model.getFields().get(1).getName(), "auto naming happens on a render-local view");
        assertFalse(model.getFields().get(1).getAttributes().containsKey("id"));
    }

    @Test
    void fourthUnnamedFieldIsCalledField4() {
        FormModel model = new FormModel();
        for (String n : new String[]{"a", "b", "c"}) {
            model.addField(Field.builder("text").name(n).attribute("name", n).build());
        }
        model.addField(Field.builder("email").build());

        String html = renderer.render(model);
        assertTrue(html.contains("<label for=\"field4\">Field4</label>"), html);
        assertTrue(html.contains("<input type=\"email\" name=\"field4\" id=\"field4\" />"), html);
    }

    @Test
    void selectListsOptionsInDeclaredOrder() {
        FormModel model = new FormModel().addField(Field.builder("select")
                .name("department").attribute("name", "department")
                .option("sales", null)
                .option("tech", "Tech Support")
                .option("receivables", null)
                .build());

        String expected = """
                <form>
                  <div class="form-group">
                    <label for="department">Department</label>
                    <select name="department" id="department">
                      <option value="sales">Sales</option>
                      <option value="tech">Tech Support</option>
                      <option value="receivables">Receivables</option>
                    </select>
                  </div>
                </form>
                """;
        assertEquals(expected, renderer.render(model));
    }

    @Test
    void radioPutsTheIdOnTheFirstInputOnly() {
        FormModel model = new FormModel().addField(Field.builder("radio")
                .name("preference").attribute("name", "preference")
                .id("pref").attribute("id", "pref")
                .option("call", "Call me back")
                .option("email", null)
                .build());

        String expected = """
                <form>
                  <div class="form-group">
                    <label><input type="radio" name="preference" id="pref" value="call"/>Call me back</label>
                    <label><input type="radio" name="preference" value="email"/>Email</label>
                  </div>
                </form>
                """;
        assertEquals(expected, renderer.render(model));
    }

    @Test
    void checkboxUsesItsOwnType() {
        FormModel model = new FormModel().addField(Field.builder("checkbox")
                .name("permission").attribute("name", "permission")
                .option("yes", "I give my permission to contact me")
                .build());

        assertTrue(renderer.render(model).contains(
                "<label><input type=\"checkbox\" name=\"permission\" id=\"permission\" value=\"yes\"/>I give my permission to contact me</label>"));
    }

    @Test
    void textareaIsNotSelfClosing() {
        FormModel model = new FormModel().addField(Field.builder("textarea")
                .name("message").attribute("name", "message").build());

        String html = renderer.render(model);
        assertTrue(html.contains("<label for=\"message\">Message</label>\n"), html);
        assertTrue(html.contains("<textarea name=\"message\" id=\"message\"></textarea>\n"), html);
    }

    @Test
    void explicitLabelWinsEvenOnSubmit() {
        FormModel model = new FormModel().addField(Field.builder("submit").label("Go").build());
        assertTrue(renderer.render(model).contains("<label for=\"field1\">Go</label>"));
    }

    @Test
    void customStrategyAndConfig() {
        RenderConfig config = new RenderConfig();
        config.setIndent("\t");
        config.setGroupClass("row");
        config.setAutoNamePrefix("q");

        HtmlFormRenderer custom = new HtmlFormRenderer(config)
                .withStrategy("hidden", (field, sb, cfg) ->
                        sb.append("<input type=\"hidden\" name=\"").append(field.name()).append("\" />\n"));

        FormModel model = new FormModel()
                .addField(Field.builder("hidden").build())
                .addField(Field.builder("text").build());

        String expected = "<form>\n"
                + "\t<div class=\"row\">\n"
                + "<input type=\"hidden\" name=\"q1\" />\n"
                + "\t</div>\n"
                + "\t<div class=\"row\">\n"
                + "\t\t<label for=\"q2\">Q2</label>\n"
                + "\t\t<input type=\"text\" name=\"q2\" id=\"q2\" />\n"
                + "\t</div>\n"
                + "</form>\n";
        assertEquals(expected, custom.render(model));
        assertEquals("  ", renderer.config().getIndent(), "the default renderer is unaffected");
    }
}
