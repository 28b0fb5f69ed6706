package com.nutritioninsights.dietanalysis.infrastructure.chart;

import com.nutritioninsights.dietanalysis.application.aggregate.DietGroupSummary;
import com.nutritioninsights.dietanalysis.application.cleaning.RecipeRecord;
import com.nutritioninsights.dietanalysis.application.ranking.DietRecipeRanking;
import com.nutritioninsights.dietanalysis.application.ranking.RankingEntry;
import com.nutritioninsights.dietanalysis.application.ranking.RankingMetric;
import com.nutritioninsights.dietanalysis.config.DietAnalysisProperties;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.CategoryLabelPositions;
import org.jfree.chart.labels.StandardPieSectionLabelGenerator;
import org.jfree.chart.plot.CategoryPlot;
import org.jfree.chart.plot.PiePlot;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.category.BarRenderer;
import org.jfree.chart.renderer.category.BoxAndWhiskerRenderer;
import org.jfree.data.category.DefaultCategoryDataset;
import org.jfree.data.general.DefaultPieDataset;
import org.jfree.data.statistics.DefaultBoxAndWhiskerCategoryDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.Paint;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 집계/랭킹 결과를 PNG 차트로 렌더링한다(JFreeChart).
 * <p>
 * 카테고리 순서와 색상은 입력 요약 목록의 순서만으로 결정된다:
 * i번째 식단 유형에는 항상 팔레트의 i번째 색이 배정된다.
 * 입력이 비어 있는 차트는 그리지 않고 {@link ChartSet#skipped()}에 남긴다.
 */
@Component
public class ChartRenderer {

    private static final Logger log = LoggerFactory.getLogger(ChartRenderer.class);

    public static final String MACROS_BY_DIET = "macronutrients_by_diet.png";
    public static final String DIET_SHARE = "diet_share.png";
    public static final String MACRO_DISTRIBUTIONS = "macronutrient_distributions.png";
    public static final String RATIO_DISTRIBUTIONS = "ratio_distributions.png";
    public static final String TOP_PROTEIN = "top_protein.png";
    public static final String TOP_PROTEIN_SCATTER = "top_protein_scatter.png";

    /** 렌더링 순서의 차트 파일명 전체 */
    public static final List<String> ALL_CHARTS = List.of(
            MACROS_BY_DIET, DIET_SHARE, MACRO_DISTRIBUTIONS, RATIO_DISTRIBUTIONS, TOP_PROTEIN, TOP_PROTEIN_SCATTER);

    private static final Paint[] DIET_PALETTE = {
            new Color(0x1F77B4), new Color(0xFF7F0E), new Color(0x2CA02C), new Color(0xD62728),
            new Color(0x9467BD), new Color(0x8C564B), new Color(0xE377C2), new Color(0x7F7F7F),
            new Color(0xBCBD22), new Color(0x17BECF)
    };

    private static final String[] NUTRIENTS = {"Protein", "Carbs", "Fat"};

    /** Protein, Carbs, Fat */
    private static final Paint[] NUTRIENT_PALETTE = {
            new Color(0x440154), new Color(0x21918C), new Color(0xFDE725)
    };

    private final int width;
    private final int height;

    public ChartRenderer(DietAnalysisProperties properties) {
        this.width = properties.charts().width();
        this.height = properties.charts().height();
    }

    /**
     * 차트를 렌더링한다.
     *
     * @param records          정제된 레시피(분포 차트용)
     * @param summaries        식단 요약(색상/카테고리 순서 기준)
     * @param topProtein       단백질 상위 레시피
     * @param topProteinByDiet 식단별 단백질 상위 레시피
     * @return 렌더링된 차트와 건너뛴 차트
     */
    public ChartSet render(
            List<RecipeRecord> records,
            List<DietGroupSummary> summaries,
            List<RankingEntry> topProtein,
            List<DietRecipeRanking> topProteinByDiet
    ) {
        List<RenderedChart> charts = new ArrayList<>();
        List<ChartSet.SkippedChart> skipped = new ArrayList<>();
        Map<String, Integer> colorIndex = colorIndex(summaries);

        if (summaries.isEmpty()) {
            skipped.add(new ChartSet.SkippedChart(MACROS_BY_DIET, "no diet summaries"));
            skipped.add(new ChartSet.SkippedChart(DIET_SHARE, "no diet summaries"));
        } else {
            charts.add(toPng(MACROS_BY_DIET, macrosByDiet(summaries)));
            charts.add(toPng(DIET_SHARE, dietShare(summaries, colorIndex)));
        }

        if (records.isEmpty()) {
            skipped.add(new ChartSet.SkippedChart(MACRO_DISTRIBUTIONS, "no records"));
        } else {
            charts.add(toPng(MACRO_DISTRIBUTIONS, macroDistributions(records, summaries)));
        }

        DefaultBoxAndWhiskerCategoryDataset ratios = ratioDataset(records, summaries);
        if (ratios.getColumnCount() == 0) {
            skipped.add(new ChartSet.SkippedChart(RATIO_DISTRIBUTIONS, "no defined ratios"));
        } else {
            charts.add(toPng(RATIO_DISTRIBUTIONS, boxPlot(
                    "Macronutrient Ratio Distributions by Diet Type", "Ratio", ratios)));
        }

        if (topProtein.isEmpty()) {
            skipped.add(new ChartSet.SkippedChart(TOP_PROTEIN, "no ranked recipes"));
        } else {
            charts.add(toPng(TOP_PROTEIN, topProtein(topProtein, colorIndex)));
        }

        if (topProteinByDiet.stream().allMatch(d -> d.entries().isEmpty())) {
            skipped.add(new ChartSet.SkippedChart(TOP_PROTEIN_SCATTER, "no ranked recipes per diet"));
        } else {
            charts.add(toPng(TOP_PROTEIN_SCATTER, topProteinScatter(topProteinByDiet, colorIndex)));
        }

        return new ChartSet(charts, skipped);
    }

    /** 평균 단백질/탄수화물/지방 grouped bar */
    private JFreeChart macrosByDiet(List<DietGroupSummary> summaries) {
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        for (DietGroupSummary s : summaries) {
            dataset.addValue(s.meanProtein(), NUTRIENTS[0], s.dietType());
            dataset.addValue(s.meanCarbs(), NUTRIENTS[1], s.dietType());
            dataset.addValue(s.meanFat(), NUTRIENTS[2], s.dietType());
        }

        JFreeChart chart = ChartFactory.createBarChart(
                "Average Macronutrients by Diet Type", "Diet Type", "Average (g)", dataset);
        CategoryPlot plot = chart.getCategoryPlot();
        BarRenderer renderer = (BarRenderer) plot.getRenderer();
        for (int i = 0; i < NUTRIENT_PALETTE.length; i++) {
            renderer.setSeriesPaint(i, NUTRIENT_PALETTE[i]);
        }
        plot.getDomainAxis().setCategoryLabelPositions(CategoryLabelPositions.UP_45);
        return chart;
    }

    /** 식단별 레시피 수 비중 pie */
    private JFreeChart dietShare(List<DietGroupSummary> summaries, Map<String, Integer> colorIndex) {
        DefaultPieDataset<String> dataset = new DefaultPieDataset<>();
        for (DietGroupSummary s : summaries) {
            dataset.setValue(s.dietType(), s.recordCount());
        }

        PiePlot<String> plot = new PiePlot<>(dataset);
        JFreeChart chart = new JFreeChart("Recipe Share by Diet Type", JFreeChart.DEFAULT_TITLE_FONT, plot, true);
        // 테마 적용이 섹션 색을 초기화하므로 색은 그 뒤에 지정한다
        ChartUtils.applyCurrentTheme(chart);
        for (DietGroupSummary s : summaries) {
            plot.setSectionPaint(s.dietType(), paintFor(colorIndex, s.dietType()));
        }
        plot.setLabelGenerator(new StandardPieSectionLabelGenerator("{0}: {2}"));
        return chart;
    }

    /** 식단별 단백질/탄수화물/지방 그램 분포 box plot */
    private JFreeChart macroDistributions(List<RecipeRecord> records, List<DietGroupSummary> summaries) {
        Map<String, List<List<Double>>> byDiet = new HashMap<>();
        for (RecipeRecord r : records) {
            List<List<Double>> grams = byDiet.computeIfAbsent(r.dietType(),
                    k -> List.of(new ArrayList<>(), new ArrayList<>(), new ArrayList<>()));
            grams.get(0).add(r.proteinG());
            grams.get(1).add(r.carbsG());
            grams.get(2).add(r.fatG());
        }

        DefaultBoxAndWhiskerCategoryDataset dataset = new DefaultBoxAndWhiskerCategoryDataset();
        for (DietGroupSummary s : summaries) {
            List<List<Double>> grams = byDiet.get(s.dietType());
            if (grams == null) continue;
            for (int i = 0; i < NUTRIENTS.length; i++) {
                dataset.add(grams.get(i), NUTRIENTS[i], s.dietType());
            }
        }
        return boxPlot("Macronutrient Distributions by Diet Type", "Amount (g)", dataset);
    }

    /** 분모가 0인 비율은 제외한다. 정의된 비율이 하나도 없는 식단은 카테고리에서 빠진다. */
    private static DefaultBoxAndWhiskerCategoryDataset ratioDataset(
            List<RecipeRecord> records,
            List<DietGroupSummary> summaries
    ) {
        Map<String, List<Double>> proteinToCarbs = new HashMap<>();
        Map<String, List<Double>> carbsToFat = new HashMap<>();
        for (RecipeRecord r : records) {
            RankingMetric.PROTEIN_TO_CARBS_RATIO.valueOf(r).ifPresent(v ->
                    proteinToCarbs.computeIfAbsent(r.dietType(), k -> new ArrayList<>()).add(v));
            RankingMetric.CARBS_TO_FAT_RATIO.valueOf(r).ifPresent(v ->
                    carbsToFat.computeIfAbsent(r.dietType(), k -> new ArrayList<>()).add(v));
        }

        DefaultBoxAndWhiskerCategoryDataset dataset = new DefaultBoxAndWhiskerCategoryDataset();
        for (DietGroupSummary s : summaries) {
            List<Double> pc = proteinToCarbs.get(s.dietType());
            if (pc != null) {
                dataset.add(pc, RankingMetric.PROTEIN_TO_CARBS_RATIO.label(), s.dietType());
            }
            List<Double> cf = carbsToFat.get(s.dietType());
            if (cf != null) {
                dataset.add(cf, RankingMetric.CARBS_TO_FAT_RATIO.label(), s.dietType());
            }
        }
        return dataset;
    }

    private JFreeChart boxPlot(String title, String valueAxis, DefaultBoxAndWhiskerCategoryDataset dataset) {
        JFreeChart chart = ChartFactory.createBoxAndWhiskerChart(title, "Diet Type", valueAxis, dataset, true);
        CategoryPlot plot = chart.getCategoryPlot();
        BoxAndWhiskerRenderer renderer = new BoxAndWhiskerRenderer();
        renderer.setMeanVisible(false);
        renderer.setMaximumBarWidth(0.08);
        for (int i = 0; i < NUTRIENT_PALETTE.length; i++) {
            renderer.setSeriesPaint(i, NUTRIENT_PALETTE[i]);
        }
        plot.setRenderer(renderer);
        plot.getDomainAxis().setCategoryLabelPositions(CategoryLabelPositions.UP_45);
        return chart;
    }

    /** 단백질 상위 레시피 horizontal bar, 막대 색은 식단 유형 */
    private JFreeChart topProtein(List<RankingEntry> entries, Map<String, Integer> colorIndex) {
        DefaultCategoryDataset dataset = new DefaultCategoryDataset();
        List<Paint> barPaints = new ArrayList<>(entries.size());
        for (RankingEntry e : entries) {
            // 레시피 이름은 중복될 수 있어 순위를 붙여 카테고리 키를 유일하게 만든다
            dataset.addValue(e.metricValue(), "Protein", e.rank() + ". " + e.record().recipeName());
            barPaints.add(paintFor(colorIndex, e.record().dietType()));
        }

        JFreeChart chart = ChartFactory.createBarChart(
                "Top Protein-Rich Recipes", "Recipe", "Protein (g)", dataset,
                PlotOrientation.HORIZONTAL, false, false, false);
        chart.getCategoryPlot().setRenderer(new BarRenderer() {
            @Override
            public Paint getItemPaint(int row, int column) {
                return barPaints.get(column);
            }
        });
        return chart;
    }

    /** 식단별 단백질 상위 레시피의 단백질 vs 탄수화물 scatter */
    private JFreeChart topProteinScatter(List<DietRecipeRanking> perDiet, Map<String, Integer> colorIndex) {
        XYSeriesCollection dataset = new XYSeriesCollection();
        List<Paint> seriesPaints = new ArrayList<>();
        for (DietRecipeRanking ranking : perDiet) {
            if (ranking.entries().isEmpty()) continue;
            XYSeries series = new XYSeries(ranking.dietType());
            for (RankingEntry e : ranking.entries()) {
                series.add(e.record().proteinG(), e.record().carbsG());
            }
            dataset.addSeries(series);
            seriesPaints.add(paintFor(colorIndex, ranking.dietType()));
        }

        JFreeChart chart = ChartFactory.createScatterPlot(
                "Top Protein-Rich Recipes: Protein vs Carbs", "Protein (g)", "Carbs (g)", dataset);
        XYPlot plot = chart.getXYPlot();
        for (int i = 0; i < seriesPaints.size(); i++) {
            plot.getRenderer().setSeriesPaint(i, seriesPaints.get(i));
        }
        return chart;
    }

    private RenderedChart toPng(String fileName, JFreeChart chart) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ChartUtils.writeChartAsPNG(out, chart, width, height);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render chart " + fileName, e);
        }
        log.debug("Rendered {} ({} bytes)", fileName, out.size());
        return new RenderedChart(fileName, out.toByteArray());
    }

    private static Map<String, Integer> colorIndex(List<DietGroupSummary> summaries) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < summaries.size(); i++) {
            index.putIfAbsent(summaries.get(i).dietType(), i);
        }
        return index;
    }

    private static Paint paintFor(Map<String, Integer> colorIndex, String dietType) {
        Integer i = colorIndex.get(dietType);
        return i == null ? Color.GRAY : DIET_PALETTE[i % DIET_PALETTE.length];
    }
}
