package com.repoatlas.core.signals;

import com.repoatlas.core.model.DataModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaParserTest {

    @Test
    @DisplayName("mongoose schemas take the model name and top-level keys only")
    void mongoose() {
        String text = """
                const userSchema = new mongoose.Schema({
                  name: { type: String, required: true },
                  email: String,
                  address: { street: String, city: String },
                }, { timestamps: true });
                module.exports = mongoose.model('User', userSchema);
                """;
        var models = SchemaParser.parse("models/User.js", text, Syntax.SCRIPT);
        assertEquals(List.of(new DataModel("User", "mongoose", List.of("address", "email", "name"), "models/User.js")), models);
    }

    @Test
    @DisplayName("sequelize define and class-init styles")
    void sequelize() {
        String text = """
                const Post = sequelize.define('Post', { title: DataTypes.STRING, body: { type: DataTypes.TEXT, allowNull: false } });
                class Comment extends Model {}
                Comment.init({ text: DataTypes.STRING, postId: DataTypes.INTEGER }, { sequelize });
                """;
        var models = SchemaParser.parse("models/index.js", text, Syntax.SCRIPT);
        assertEquals(2, models.size());
        assertEquals(List.of("body", "title"), models.get(0).fields());
        assertEquals("Comment", models.get(1).name());
        assertEquals(List.of("postId", "text"), models.get(1).fields());
    }

    @Test
    @DisplayName("typeorm entities list decorated columns")
    void typeorm() {
        String text = """
                @Entity()
                export class Order {
                  @PrimaryGeneratedColumn() id: number;
                  @Column() total: number;
                  @ManyToOne(() => User) customer: User;
                }
                """;
        var models = SchemaParser.parse("src/entity/Order.ts", text, Syntax.SCRIPT);
        assertEquals(1, models.size());
        assertEquals("typeorm", models.get(0).type());
        assertTrue(models.get(0).fields().containsAll(List.of("id", "total")));
    }

    @Test
    @DisplayName("JPA entities list instance fields but not constants")
    void jpa() {
        String text = """
                @Entity
                @Table(name = "accounts")
                public class Account {
                    private static final long serialVersionUID = 1L;
                    @Id
                    private Long id;
                    private String owner;
                    protected BigDecimal balance = BigDecimal.ZERO;
                }
                """;
        var models = SchemaParser.parse("src/Account.java", text, Syntax.JAVA);
        assertEquals(List.of(new DataModel("Account", "jpa", List.of("balance", "id", "owner"), "src/Account.java")), models);
    }

    @Test
    @DisplayName("python models stop at the next top-level statement")
    void pythonModels() {
        String text = """
                class User(db.Model):
                    id = db.Column(db.Integer, primary_key=True)
                    name = db.Column(db.String(80))

                class Article(models.Model):
                    title = models.CharField(max_length=100)

                helper = Column()
                """;
        var models = SchemaParser.parse("app/models.py", text, Syntax.PYTHON);
        assertEquals(2, models.size());
        assertEquals(new DataModel("User", "sqlalchemy", List.of("id", "name"), "app/models.py"), models.get(0));
        assertEquals(new DataModel("Article", "django", List.of("title"), "app/models.py"), models.get(1));
    }
}
